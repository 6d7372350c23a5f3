package tech.yump.vaultclient;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.vaultclient.config.VaultClientProperties;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(VaultClientProperties.class)
public class LiteVaultClientApplication {

  public static void main(String[] args) {
    SpringApplication.run(LiteVaultClientApplication.class, args);
    log.info(">>> LiteVault Client Application Started <<<");
  }
}
