package com.vibecoding.pvecheck.config;

import com.vibecoding.pvecheck.model.RuleTriple;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 검증이 끝난 실행 옵션
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProbeOptions {
    @Builder.Default
    private List<String> hosts = new ArrayList<>();
    @Builder.Default
    private String username = "root";
    private String password;
    @Builder.Default
    private int port = 8006;
    @Builder.Default
    private String realm = "pam";
    private String mode;
    @Builder.Default
    private List<RuleTriple> warnStrings = new ArrayList<>();
    @Builder.Default
    private List<RuleTriple> critStrings = new ArrayList<>();
    @Builder.Default
    private List<RuleTriple> overrides = new ArrayList<>();
    private String filter;
    private boolean insecure;
    private boolean help;
    private boolean debug;
    private boolean verbose;

    /**
     * 로그인에 쓰는 사용자 ID (user@realm)
     */
    public String getLoginName() {
        return username + "@" + realm;
    }
}
