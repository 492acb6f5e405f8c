package com.flagship.asset_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AssetLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssetLedgerApplication.class, args);
    }
}
