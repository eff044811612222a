package lab.accessmanager;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AccessManagerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccessManagerApplication.class, args);
    }
}
