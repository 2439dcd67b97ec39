package com.vaultmarket.tradeserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TradeServerApplication {
  public static void main(String[] args) {
    SpringApplication.run(TradeServerApplication.class, args);
  }
}
