package com.flagship.order_ledger.projection;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Looks customer names up in the customers table.
 */
@Component
public class JdbcCustomerDirectory implements CustomerDirectory {

    private final JdbcTemplate jdbcTemplate;

    public JdbcCustomerDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<String> findName(UUID customerId) {
        List<String> names = jdbcTemplate.queryForList(
            "SELECT name FROM customers WHERE id = ?",
            String.class,
            customerId
        );
        return names.stream().findFirst();
    }
}
