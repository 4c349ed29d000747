package com.warehouse.requisitions.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "requisitions")
public class RequisitionProperties {

    private Code code = new Code();
    private History history = new History();

    // Demo users, areas, machines and items on an empty database
    private boolean seedDemoData = true;

    @Data
    public static class Code {
        // Calendar used for REQ-YYYYMMDD-NNNN; fixed for all users
        private String zone = "UTC";
        private int maxAttempts = 5;
    }

    @Data
    public static class History {
        private int defaultLimit = 500;
        private int maxLimit = 5000;
    }
}
