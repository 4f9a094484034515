package bio.terra.pouch;

import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication(scanBasePackages = {"bio.terra.pouch"})
public class PouchApplication {

  public static void main(String[] args) {
    new SpringApplicationBuilder(PouchApplication.class).web(WebApplicationType.NONE).run(args);
  }
}
