package com.example.admission;

/**
 * 有効なAPIキーの問い合わせ先。
 * 中身が静的な Set でも DB でも外部サービスでも、ゲート側からは isValid しか見えない。
 */
public interface ApiKeyStore {
    boolean isValid(String apiKey);
}
