package com.warehouse.requisitions.controller;

import com.warehouse.requisitions.dto.CreateAreaRequest;
import com.warehouse.requisitions.dto.CreateMachineRequest;
import com.warehouse.requisitions.dto.CreateUserRequest;
import com.warehouse.requisitions.dto.RegisterInventoryItemRequest;
import com.warehouse.requisitions.dto.UpdateUserRequest;
import com.warehouse.requisitions.dto.UserView;
import com.warehouse.requisitions.model.Area;
import com.warehouse.requisitions.model.InventoryItem;
import com.warehouse.requisitions.model.Machine;
import com.warehouse.requisitions.service.AppUserPrincipal;
import com.warehouse.requisitions.service.ReferenceDataService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/admin")
@PreAuthorize("hasRole('ADMINISTRATOR')")
public class AdminController {

    private final ReferenceDataService referenceDataService;

    public AdminController(ReferenceDataService referenceDataService) {
        this.referenceDataService = referenceDataService;
    }

    @GetMapping("/users")
    public List<UserView> users() {
        return referenceDataService.listUsers();
    }

    @PostMapping("/users")
    @ResponseStatus(HttpStatus.CREATED)
    public UserView createUser(@AuthenticationPrincipal AppUserPrincipal principal,
            @Valid @RequestBody CreateUserRequest request) {
        return referenceDataService.createUser(principal.getUsername(), request);
    }

    @PutMapping("/users/{id}")
    public UserView updateUser(@AuthenticationPrincipal AppUserPrincipal principal,
            @PathVariable Long id,
            @RequestBody UpdateUserRequest request) {
        return referenceDataService.updateUser(principal.getUsername(), id, request);
    }

    @GetMapping("/areas")
    public List<Area> areas() {
        return referenceDataService.listAreas();
    }

    @PostMapping("/areas")
    @ResponseStatus(HttpStatus.CREATED)
    public Area createArea(@AuthenticationPrincipal AppUserPrincipal principal,
            @Valid @RequestBody CreateAreaRequest request) {
        return referenceDataService.createArea(principal.getUsername(), request);
    }

    @GetMapping("/machines")
    public List<Machine> machines() {
        return referenceDataService.listMachines();
    }

    @PostMapping("/machines")
    @ResponseStatus(HttpStatus.CREATED)
    public Machine createMachine(@AuthenticationPrincipal AppUserPrincipal principal,
            @Valid @RequestBody CreateMachineRequest request) {
        return referenceDataService.createMachine(principal.getUsername(), request);
    }

    @GetMapping("/inventory")
    public List<InventoryItem> inventory() {
        return referenceDataService.listInventory();
    }

    @PostMapping("/inventory")
    @ResponseStatus(HttpStatus.CREATED)
    public InventoryItem registerInventoryItem(@AuthenticationPrincipal AppUserPrincipal principal,
            @Valid @RequestBody RegisterInventoryItemRequest request) {
        return referenceDataService.registerInventoryItem(principal.getUsername(), request);
    }
}
