package com.warehouse.requisitions.service;

import com.warehouse.requisitions.dto.CreateAreaRequest;
import com.warehouse.requisitions.dto.CreateMachineRequest;
import com.warehouse.requisitions.dto.CreateUserRequest;
import com.warehouse.requisitions.dto.RegisterInventoryItemRequest;
import com.warehouse.requisitions.dto.UpdateUserRequest;
import com.warehouse.requisitions.dto.UserView;
import com.warehouse.requisitions.exception.ErrorCode;
import com.warehouse.requisitions.exception.ValidationException;
import com.warehouse.requisitions.model.Area;
import com.warehouse.requisitions.model.InventoryItem;
import com.warehouse.requisitions.model.Machine;
import com.warehouse.requisitions.model.User;
import com.warehouse.requisitions.repository.AreaRepository;
import com.warehouse.requisitions.repository.InventoryItemRepository;
import com.warehouse.requisitions.repository.MachineRepository;
import com.warehouse.requisitions.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Administrator maintenance of users, areas, machines and inventory items.
 */
@Service
public class ReferenceDataService {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceDataService.class);

    private final UserRepository userRepository;
    private final AreaRepository areaRepository;
    private final MachineRepository machineRepository;
    private final InventoryItemRepository inventoryItemRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuditService auditService;

    public ReferenceDataService(UserRepository userRepository,
            AreaRepository areaRepository,
            MachineRepository machineRepository,
            InventoryItemRepository inventoryItemRepository,
            PasswordEncoder passwordEncoder,
            AuditService auditService) {
        this.userRepository = userRepository;
        this.areaRepository = areaRepository;
        this.machineRepository = machineRepository;
        this.inventoryItemRepository = inventoryItemRepository;
        this.passwordEncoder = passwordEncoder;
        this.auditService = auditService;
    }

    @Transactional
    public UserView createUser(String actor, CreateUserRequest request) {
        String username = request.getUsername().trim();
        if (userRepository.existsByUsername(username)) {
            throw new ValidationException(ErrorCode.DUPLICATE_REFERENCE, "Username already taken: " + username);
        }

        User user = new User();
        user.setUsername(username);
        user.setFullName(request.getFullName());
        user.setPassword(passwordEncoder.encode(request.getPassword()));
        user.setRole(request.getRole());
        User saved = userRepository.save(user);

        auditService.log(actor, "USER_CREATED", username + " as " + saved.getRole());
        logger.info("User {} created with role {}", username, saved.getRole());
        return UserView.from(saved);
    }

    @Transactional
    public UserView updateUser(String actor, Long userId, UpdateUserRequest request) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> ValidationException.unknownUser(userId));

        StringBuilder changes = new StringBuilder(user.getUsername());
        if (request.getPassword() != null && !request.getPassword().isBlank()) {
            if (request.getPassword().length() < 4) {
                throw new ValidationException(ErrorCode.INVALID_INPUT, "Password must have at least 4 characters");
            }
            user.setPassword(passwordEncoder.encode(request.getPassword()));
            changes.append(": password reset");
        }
        if (request.getRole() != null && request.getRole() != user.getRole()) {
            changes.append(": role ").append(user.getRole()).append(" -> ").append(request.getRole());
            user.setRole(request.getRole());
        }
        User saved = userRepository.save(user);

        auditService.log(actor, "USER_UPDATED", changes.toString());
        return UserView.from(saved);
    }

    @Transactional(readOnly = true)
    public List<UserView> listUsers() {
        return userRepository.findAll(Sort.by("username")).stream()
                .map(UserView::from)
                .toList();
    }

    @Transactional
    public Area createArea(String actor, CreateAreaRequest request) {
        String code = request.getCode().trim();
        if (areaRepository.findByCode(code).isPresent()) {
            throw new ValidationException(ErrorCode.DUPLICATE_REFERENCE, "Area code already in use: " + code);
        }
        Area area = new Area();
        area.setCode(code);
        area.setName(request.getName());
        Area saved = areaRepository.save(area);

        auditService.log(actor, "AREA_CREATED", code);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Area> listAreas() {
        return areaRepository.findAll(Sort.by("code"));
    }

    @Transactional
    public Machine createMachine(String actor, CreateMachineRequest request) {
        String code = request.getCode().trim();
        if (machineRepository.findByCode(code).isPresent()) {
            throw new ValidationException(ErrorCode.DUPLICATE_REFERENCE, "Machine code already in use: " + code);
        }
        Machine machine = new Machine();
        machine.setCode(code);
        machine.setName(request.getName());
        if (request.getAreaId() != null) {
            machine.setArea(areaRepository.findById(request.getAreaId())
                    .orElseThrow(() -> ValidationException.unknownReference("Area", request.getAreaId())));
        }
        Machine saved = machineRepository.save(machine);

        auditService.log(actor, "MACHINE_CREATED", code);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Machine> listMachines() {
        return machineRepository.findAll(Sort.by("code"));
    }

    @Transactional
    public InventoryItem registerInventoryItem(String actor, RegisterInventoryItemRequest request) {
        String sku = request.getSku().trim();
        if (inventoryItemRepository.findBySku(sku).isPresent()) {
            throw new ValidationException(ErrorCode.DUPLICATE_REFERENCE, "SKU already registered: " + sku);
        }
        BigDecimal initialStock = request.getInitialStock() != null ? request.getInitialStock() : BigDecimal.ZERO;
        if (initialStock.signum() < 0) {
            throw new ValidationException(ErrorCode.INVALID_INPUT, "Initial stock cannot be negative");
        }
        if (!Quantities.fitsColumn(initialStock)) {
            throw ValidationException.unsupportedQuantity(ErrorCode.INVALID_INPUT, "Initial stock", initialStock);
        }

        InventoryItem item = new InventoryItem();
        item.setSku(sku);
        item.setDescription(request.getDescription());
        item.setStock(initialStock);
        if (request.getUnit() != null && !request.getUnit().isBlank()) {
            item.setUnit(request.getUnit().trim());
        }
        InventoryItem saved = inventoryItemRepository.save(item);

        auditService.log(actor, "INVENTORY_ITEM_REGISTERED", sku + " stock " + initialStock.toPlainString());
        logger.info("Inventory item {} registered with stock {}", sku, initialStock);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<InventoryItem> listInventory() {
        return inventoryItemRepository.findAll(Sort.by("sku"));
    }
}
