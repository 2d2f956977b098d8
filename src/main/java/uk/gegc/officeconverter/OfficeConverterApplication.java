package uk.gegc.officeconverter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class OfficeConverterApplication {

    public static void main(String[] args) {
        SpringApplication.run(OfficeConverterApplication.class, args);
    }
}
