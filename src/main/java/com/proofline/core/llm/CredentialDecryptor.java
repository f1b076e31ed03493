package com.proofline.core.llm;

/**
 * Turns a stored {@code api_key_encrypted} value into a usable API key.
 */
public interface CredentialDecryptor {

    /**
     * @return the key, or an empty string when none is stored
     */
    String decrypt(String encrypted);
}
