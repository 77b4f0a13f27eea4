package com.vibecoding.pvecheck.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * /version 응답
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiVersion {
    private String version;   // 8.1.4
}
