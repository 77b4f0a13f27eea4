package com.vibecoding.pvecheck.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 점검 모드
 *
 * 모드별로 조회할 API 경로, 객체 타입, 성능 필드(단위)와 객체 표시 이름 규칙을 가진다.
 */
public enum CheckMode {
    NODE("node", "Check cluster nodes (cpu, memory, root disk, uptime)",
            "/cluster/resources", perfFields("cpu", "", "disk", "B", "mem", "B", "uptime", "s")) {
        @Override
        public String displayName(ResourceObject object) {
            return object.getString("node");
        }
    },
    QEMU("qemu", "Check QEMU virtual machines",
            "/cluster/resources", guestPerfFields()) {
        @Override
        public String displayName(ResourceObject object) {
            return object.getString("node") + "." + object.getString("name");
        }
    },
    LXC("lxc", "Check LXC containers",
            "/cluster/resources", guestPerfFields()) {
        @Override
        public String displayName(ResourceObject object) {
            return object.getString("name");
        }
    },
    STORAGE("storage", "Check storage usage",
            "/cluster/resources", perfFields("disk", "B")) {
        @Override
        public String displayName(ResourceObject object) {
            // storage 레코드에는 name이 없고 storage 필드만 있다
            String name = object.has("name") ? object.getString("name") : object.getString("storage");
            return object.getString("node") + "." + name;
        }
    },
    STATUS("status", "Check cluster quorum and node membership",
            "/cluster/status", Collections.emptyMap()) {
        @Override
        public String displayName(ResourceObject object) {
            return object.getString("name");
        }
    };

    private final String modeName;
    private final String help;
    private final String apiPath;
    private final Map<String, String> perfFields;

    CheckMode(String modeName, String help, String apiPath, Map<String, String> perfFields) {
        this.modeName = modeName;
        this.help = help;
        this.apiPath = apiPath;
        this.perfFields = Collections.unmodifiableMap(new TreeMap<>(perfFields));
    }

    /**
     * 객체의 사람이 읽을 수 있는 식별자
     */
    public abstract String displayName(ResourceObject object);

    public String getModeName() {
        return modeName;
    }

    public String getHelp() {
        return help;
    }

    public String getApiPath() {
        return apiPath;
    }

    /**
     * 성능 필드 이름 -> 단위, 필드 이름 순으로 정렬됨
     */
    public Map<String, String> getPerfFields() {
        return perfFields;
    }

    /**
     * /cluster/resources 결과에서 이 모드의 객체만 고르는 표현식
     */
    public String typeExpression() {
        return "type=" + modeName;
    }

    public boolean isResourceMode() {
        return this != STATUS;
    }

    public static Optional<CheckMode> fromName(String name) {
        return Arrays.stream(values())
                .filter(mode -> mode.modeName.equals(name))
                .findFirst();
    }

    public static String availableModes() {
        return Arrays.stream(values())
                .map(CheckMode::getModeName)
                .collect(Collectors.joining(", "));
    }

    private static Map<String, String> perfFields(String... fieldAndUnit) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 0; i < fieldAndUnit.length; i += 2) {
            fields.put(fieldAndUnit[i], fieldAndUnit[i + 1]);
        }
        return fields;
    }

    private static Map<String, String> guestPerfFields() {
        return perfFields(
                "cpu", "",
                "disk", "B",
                "diskread", "B",
                "diskwrite", "B",
                "mem", "B",
                "netin", "B",
                "netout", "B",
                "uptime", "s");
    }
}
