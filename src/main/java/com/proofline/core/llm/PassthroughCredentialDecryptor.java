package com.proofline.core.llm;

import org.springframework.stereotype.Component;

/**
 * Keys are stored as-is. Replace this bean to plug in a real key store.
 */
@Component
public class PassthroughCredentialDecryptor implements CredentialDecryptor {

    @Override
    public String decrypt(String encrypted) {
        return encrypted == null ? "" : encrypted.trim();
    }
}
