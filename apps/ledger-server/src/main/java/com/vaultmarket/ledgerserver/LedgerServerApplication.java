package com.vaultmarket.ledgerserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LedgerServerApplication {
  public static void main(String[] args) {
    SpringApplication.run(LedgerServerApplication.class, args);
  }
}
