package structured.error;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class StructuredErrorApplication {

  public static void main(String[] args) {
    SpringApplication.run(StructuredErrorApplication.class, args);
  }
}
