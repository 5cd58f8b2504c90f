package uma;

import java.security.Security;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class UmaCoreApplication {

    public static void main(String[] args) {
        Security.addProvider(new BouncyCastleProvider());

        SpringApplication.run(UmaCoreApplication.class, args);
    }

}
