package cex.oceanbook.matching;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OceanbookMatchingApplication {

    public static void main(String[] args) {
        SpringApplication.run(OceanbookMatchingApplication.class, args);
    }
}
