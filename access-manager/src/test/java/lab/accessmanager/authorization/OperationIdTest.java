package lab.accessmanager.authorization;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperationIdTest {

    @Test
    void ofSignature_usesFirstFourBytesOfKeccak() {
        assertThat(OperationId.ofSignature("transfer(address,uint256)").selector()).isEqualTo("0xa9059cbb");
        assertThat(OperationId.ofSignature("transferFrom(address,address,uint256)").selector()).isEqualTo("0x23b872dd");
        assertThat(OperationId.ofSignature("deposit(uint256,address)").selector()).isEqualTo("0x6e553f65");
    }

    @Test
    void fromPayload_readsSelectorAndIgnoresCase() {
        OperationId operation = OperationId.fromPayload("0xA9059CBB000000000000000000000000000000000000000000000000000000000000dead");

        assertThat(operation).isEqualTo(OperationId.ofSignature("transfer(address,uint256)"));
    }

    @Test
    void invalidSelectors_areRejected() {
        assertThatThrownBy(() -> new OperationId("0x1234")).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> OperationId.fromPayload("0x12")).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> OperationId.ofSignature("transfer")).isInstanceOf(InvalidRequestException.class);
    }
}
