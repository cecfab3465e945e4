package io.statusmvp.pricefeed.config;

import io.statusmvp.pricefeed.ledger.InMemoryLedger;
import io.statusmvp.pricefeed.ledger.PriceLedger;
import io.statusmvp.pricefeed.ledger.Web3jPriceFeedLedger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

@Configuration
public class LedgerConfig {

  @Bean
  @ConditionalOnProperty(name = "app.ledger.mode", havingValue = "web3")
  public Web3j ledgerWeb3j(LedgerProperties properties) {
    if (properties.getRpcUrl() == null || properties.getRpcUrl().isBlank()) {
      throw new IllegalStateException("app.ledger.rpc-url is required in web3 mode");
    }
    return Web3j.build(new HttpService(properties.getRpcUrl().trim()));
  }

  @Bean
  @ConditionalOnProperty(name = "app.ledger.mode", havingValue = "web3")
  public PriceLedger web3PriceLedger(Web3j ledgerWeb3j, LedgerProperties properties) {
    if (properties.getPrivateKey() == null || properties.getPrivateKey().isBlank()) {
      throw new IllegalStateException("app.ledger.private-key is required in web3 mode");
    }
    return new Web3jPriceFeedLedger(ledgerWeb3j, properties);
  }

  @Bean
  @ConditionalOnProperty(name = "app.ledger.mode", havingValue = "memory", matchIfMissing = true)
  public PriceLedger inMemoryPriceLedger() {
    return new InMemoryLedger();
  }
}
