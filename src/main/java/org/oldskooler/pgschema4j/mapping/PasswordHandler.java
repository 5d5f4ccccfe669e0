package org.oldskooler.pgschema4j.mapping;

import java.util.function.BiFunction;

/**
 * Optional application side hooks for password columns.
 * Without an encrypt hook inserts and updates hash through {@code crypt(..., gen_salt(..))};
 * without a decrypt hook scanned password values are assigned as stored.
 * A decrypt hook returning an empty string leaves the field untouched, which suits
 * hooks that only verify.
 */
public final class PasswordHandler {
    private final BiFunction<String, String, String> encrypt;
    private final BiFunction<String, String, String> decrypt;

    /**
     * @param encrypt (tableName, plainPassword) to stored value, may be null
     * @param decrypt (tableName, storedValue) to plain value, may be null
     */
    public PasswordHandler(BiFunction<String, String, String> encrypt, BiFunction<String, String, String> decrypt) {
        this.encrypt = encrypt;
        this.decrypt = decrypt;
    }

    public boolean canEncrypt() {
        return encrypt != null;
    }

    public boolean canDecrypt() {
        return decrypt != null;
    }

    public String encrypt(String tableName, String plainPassword) {
        if (encrypt == null) throw new IllegalStateException("no encrypt hook configured");
        return encrypt.apply(tableName, plainPassword);
    }

    public String decrypt(String tableName, String encryptedPassword) {
        if (decrypt == null) throw new IllegalStateException("no decrypt hook configured");
        return decrypt.apply(tableName, encryptedPassword);
    }
}
