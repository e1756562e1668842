package com.example.admission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * 設定ファイルに書かれたキーだけを有効とする ApiKeyStore。
 * 起動時にコピーを取るので、後から設定オブジェクトを書き換えても影響しない。
 */
@Component
public class StaticApiKeyStore implements ApiKeyStore {

    private static final Logger log = LoggerFactory.getLogger(StaticApiKeyStore.class);

    private final Set<String> keys;

    public StaticApiKeyStore(ApiKeyProperties props) {
        this.keys = props.getKeys().stream()
                .filter(k -> k != null && !k.isBlank())
                .collect(Collectors.toUnmodifiableSet());
        if (keys.isEmpty()) {
            log.warn("No API keys configured (apikeys.keys), every protected request will be rejected");
        } else {
            log.info("Loaded {} API keys", keys.size());
        }
    }

    @Override
    public boolean isValid(String apiKey) {
        return apiKey != null && keys.contains(apiKey);
    }
}
