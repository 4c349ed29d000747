package com.warehouse.requisitions.config;

import com.warehouse.requisitions.model.*;
import com.warehouse.requisitions.repository.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.math.BigDecimal;

@Configuration
public class DataInitializer {

    private static final Logger logger = LoggerFactory.getLogger(DataInitializer.class);

    static final String DEMO_PASSWORD = "password";

    @Bean
    CommandLineRunner init(RequisitionProperties properties,
            UserRepository userRepo,
            AreaRepository areaRepo,
            MachineRepository machineRepo,
            InventoryItemRepository itemRepo,
            PasswordEncoder encoder) {
        return args -> {
            if (!properties.isSeedDemoData()) {
                return;
            }

            if (userRepo.count() == 0) {
                userRepo.save(user("requester1", "Floor Requester", UserRole.REQUESTER, encoder));
                userRepo.save(user("approver1", "Warehouse Approver", UserRole.APPROVER, encoder));
                userRepo.save(user("admin", "System Admin", UserRole.ADMINISTRATOR, encoder));
                logger.info("Seeded demo users requester1, approver1 and admin");
            }

            if (areaRepo.count() == 0) {
                Area areaA = areaRepo.save(area("A1", "Area A"));
                Area areaB = areaRepo.save(area("A2", "Area B"));

                // Machines reference the areas, so they are only seeded alongside them
                if (machineRepo.count() == 0) {
                    machineRepo.save(machine("MACH-001", "Cutter 1", areaA));
                    machineRepo.save(machine("MACH-002", "Drill 1", areaB));
                }
            }

            if (itemRepo.count() == 0) {
                itemRepo.save(item("SKU-001", "Filter", new BigDecimal("50"), "un"));
                itemRepo.save(item("SKU-002", "M8 Screw", new BigDecimal("1000"), "pcs"));
                logger.info("Seeded demo inventory");
            }
        };
    }

    private static User user(String username, String fullName, UserRole role, PasswordEncoder encoder) {
        User user = new User();
        user.setUsername(username);
        user.setFullName(fullName);
        user.setPassword(encoder.encode(DEMO_PASSWORD));
        user.setRole(role);
        return user;
    }

    private static Area area(String code, String name) {
        Area area = new Area();
        area.setCode(code);
        area.setName(name);
        return area;
    }

    private static Machine machine(String code, String name, Area area) {
        Machine machine = new Machine();
        machine.setCode(code);
        machine.setName(name);
        machine.setArea(area);
        return machine;
    }

    private static InventoryItem item(String sku, String description, BigDecimal stock, String unit) {
        InventoryItem item = new InventoryItem();
        item.setSku(sku);
        item.setDescription(description);
        item.setStock(stock);
        item.setUnit(unit);
        return item;
    }
}
