package battetl.transform;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BattEtlTransformApplication {

    public static void main(String[] args) {
        SpringApplication.run(BattEtlTransformApplication.class, args);
    }
}
