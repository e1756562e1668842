package com.example.admission;

import java.util.Optional;

/**
 * キー(APIキー)ごとの許可/拒否を決めるレートリミッター。
 */
public interface RateLimiterService {

    /**
     * key のバケツから1トークン消費を試みる。
     * 初めて見るキーは満タン-1 の状態で作られ、必ず許可される。
     */
    AllowResult allow(String key);

    /** key のバケツの現在値。存在しなければ空 (バケツは作らない)。 */
    Optional<BucketSnapshot> snapshot(String key);

    /** 追跡中のキー数 */
    int size();
}
