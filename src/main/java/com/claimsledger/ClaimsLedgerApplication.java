package com.claimsledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Claims Ledger: liability decisions and append-only claim ledgers for
 * insurance and reinsurance portfolios.
 *
 * @EnableTransactionManagement is declared explicitly so that @Transactional
 * (row locks, repeatable-read snapshots) never silently stops applying.
 */
@SpringBootApplication
@EnableTransactionManagement
public class ClaimsLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClaimsLedgerApplication.class, args);
    }

}
