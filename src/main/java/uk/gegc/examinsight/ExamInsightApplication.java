package uk.gegc.examinsight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExamInsightApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExamInsightApplication.class, args);
    }

}
