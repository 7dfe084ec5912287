package it.aw.textingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TextIngestApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TextIngestApplication.class, args)));
    }
}
