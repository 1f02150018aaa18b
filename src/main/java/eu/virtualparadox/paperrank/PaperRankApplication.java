package eu.virtualparadox.paperrank;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PaperRankApplication {

    public static void main(final String[] args) {
        // exit status comes from PaperRankRunner
        System.exit(SpringApplication.exit(SpringApplication.run(PaperRankApplication.class, args)));
    }
}
