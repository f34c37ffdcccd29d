package ch.so.arp.rag.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RagEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RagEngineApplication.class, args);
    }
}
