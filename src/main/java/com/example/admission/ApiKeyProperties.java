package com.example.admission;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * APIキー関連の設定値。
 *
 * keys:
 *   有効なAPIキーの一覧 (StaticApiKeyStore が使う)
 * protectedPaths:
 *   AdmissionGate を通すパス。ここに無いパス (actuator など) はチェックしない
 */
@ConfigurationProperties(prefix = "apikeys")
public class ApiKeyProperties {
    private Set<String> keys = new LinkedHashSet<>();

    private List<String> protectedPaths = new ArrayList<>(List.of("/hello", "/world"));

    public Set<String> getKeys() { return keys; }
    public void setKeys(Set<String> keys) { this.keys = keys; }

    public List<String> getProtectedPaths() { return protectedPaths; }
    public void setProtectedPaths(List<String> protectedPaths) { this.protectedPaths = protectedPaths; }
}
