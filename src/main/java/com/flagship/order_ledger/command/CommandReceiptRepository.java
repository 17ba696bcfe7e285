package com.flagship.order_ledger.command;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CommandReceiptRepository extends JpaRepository<CommandReceiptEntity, String> {
}
