package com.warehouse.requisitions.controller;

import com.warehouse.requisitions.model.InventoryItem;
import com.warehouse.requisitions.service.InventoryLedgerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/inventory")
public class InventoryController {

    private final InventoryLedgerService ledger;

    public InventoryController(InventoryLedgerService ledger) {
        this.ledger = ledger;
    }

    @GetMapping
    public List<InventoryItem> list() {
        return ledger.listAll();
    }
}
