package pe.farmaciasperuanas.digital.process.clickstream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ClickstreamProcessApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClickstreamProcessApplication.class, args);
    }
}
