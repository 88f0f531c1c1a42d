package com.jupiter.query.provider.clickhouse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps logical OCSF field names to columns of the ClickHouse events table.
 * Names without an entry are used as column names unchanged.
 */
public final class FieldMapping {

    private final Map<String, String> columns;

    public FieldMapping(Map<String, String> columns) {
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public String toColumn(String field) {
        return columns.getOrDefault(field, field);
    }

    public boolean isMapped(String field) {
        return columns.containsKey(field);
    }

    /**
     * @return read-only view of the full mapping table
     */
    public Map<String, String> asMap() {
        return columns;
    }

    /**
     * Default mapping for the {@code ocsf_events} table
     */
    public static FieldMapping ocsfDefaults() {
        Map<String, String> m = new LinkedHashMap<>();

        // Core OCSF fields
        m.put("time", "time");
        m.put("event_uid", "event_uid");
        m.put("tenant_id", "tenant_id");
        m.put("class_uid", "class_uid");
        m.put("class_name", "class_name");
        m.put("category_uid", "category_uid");
        m.put("category_name", "category_name");
        m.put("activity_name", "activity_name");
        m.put("severity", "severity");
        m.put("message", "message");

        // Actor/User fields
        m.put("user.name", "actor_user_name");
        m.put("user.uid", "actor_user_uid");
        m.put("user.type", "actor_user_type");
        m.put("user.domain", "actor_user_domain");
        m.put("user.email", "actor_user_email");
        m.put("actor_user_name", "actor_user_name");

        // Device fields
        m.put("device.name", "device_name");
        m.put("device.type", "device_type");
        m.put("device.ip", "device_ip");
        m.put("device.hostname", "device_hostname");
        m.put("device.mac", "device_mac");
        m.put("device.os.name", "device_os_name");
        m.put("device.os.version", "device_os_version");

        // Network fields
        m.put("src_endpoint.ip", "src_endpoint_ip");
        m.put("src_endpoint.port", "src_endpoint_port");
        m.put("dst_endpoint.ip", "dst_endpoint_ip");
        m.put("dst_endpoint.port", "dst_endpoint_port");
        m.put("network.protocol", "network_protocol");
        m.put("network.direction", "network_direction");

        // Process fields
        m.put("process.name", "process_name");
        m.put("process.pid", "process_pid");
        m.put("process.cmd_line", "process_cmd_line");
        m.put("process.parent.name", "process_parent_name");
        m.put("process.parent.pid", "process_parent_pid");

        // File fields
        m.put("file.name", "file_name");
        m.put("file.path", "file_path");
        m.put("file.size", "file_size");
        m.put("file.hash.md5", "file_hash_md5");
        m.put("file.hash.sha1", "file_hash_sha1");
        m.put("file.hash.sha256", "file_hash_sha256");

        // Registry fields
        m.put("registry.key", "registry_key");
        m.put("registry.value", "registry_value");
        m.put("registry.type", "registry_type");

        // Authentication fields
        m.put("auth.method", "auth_method");
        m.put("auth.result", "auth_result");
        m.put("logon_type", "logon_type");

        // HTTP fields
        m.put("http.method", "http_method");
        m.put("http.status_code", "http_status_code");
        m.put("http.url", "http_url");
        m.put("http.user_agent", "http_user_agent");
        m.put("http.referrer", "http_referrer");

        // DNS fields
        m.put("dns.query", "dns_query");
        m.put("dns.response", "dns_response");
        m.put("dns.type", "dns_type");

        // Enrichment fields
        m.put("enrichment.geo.country", "enrichment_geo_country");
        m.put("enrichment.geo.city", "enrichment_geo_city");
        m.put("enrichment.threat_score", "enrichment_threat_score");
        m.put("enrichment.reputation", "enrichment_reputation");

        // MITRE ATT&CK fields
        m.put("mitre.technique.id", "mitre_technique_id");
        m.put("mitre.technique.name", "mitre_technique_name");
        m.put("mitre.tactic.id", "mitre_tactic_id");
        m.put("mitre.tactic.name", "mitre_tactic_name");

        // Risk/Confidence
        m.put("risk_score", "risk_score");
        m.put("confidence", "confidence");

        return new FieldMapping(m);
    }
}
