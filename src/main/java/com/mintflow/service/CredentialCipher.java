package com.mintflow.service;

import com.mintflow.config.CryptoProperties;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Service;

/**
 * AES-GCM sealing of provider credentials. A sealed value is {@code keyId:iv:ciphertext} and the
 * provider id is bound as associated data, so a credential only opens for the provider that issued it.
 */
@Service
public class CredentialCipher {
  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final int GCM_TAG_LENGTH = 128;
  private static final int IV_LENGTH = 12;

  private final String activeKeyId;
  private final Map<String, SecretKey> keys = new LinkedHashMap<>();
  private final SecureRandom secureRandom = new SecureRandom();

  public CredentialCipher(CryptoProperties properties) {
    SecretKey active = toKey(properties.secret(), "mintflow.crypto.secret");
    this.activeKeyId = keyId(active);
    keys.put(activeKeyId, active);
    for (String retired : properties.retiredSecrets()) {
      SecretKey key = toKey(retired, "mintflow.crypto.retired-secrets");
      keys.putIfAbsent(keyId(key), key);
    }
  }

  public String seal(String providerId, String credential) {
    if (credential == null || credential.isBlank()) {
      throw new IllegalArgumentException("credential is required");
    }
    byte[] iv = new byte[IV_LENGTH];
    secureRandom.nextBytes(iv);
    try {
      Cipher cipher = cipher(Cipher.ENCRYPT_MODE, keys.get(activeKeyId), iv, providerId);
      byte[] sealed = cipher.doFinal(credential.getBytes(StandardCharsets.UTF_8));
      Base64.Encoder encoder = Base64.getEncoder();
      return activeKeyId + ":" + encoder.encodeToString(iv) + ":" + encoder.encodeToString(sealed);
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("Failed to seal credential", ex);
    }
  }

  public String open(String providerId, String sealedCredential) {
    String[] parts = sealedCredential == null ? new String[0] : sealedCredential.split(":", 3);
    if (parts.length != 3) {
      throw new IllegalStateException("Stored credential is not in sealed form");
    }
    SecretKey key = keys.get(parts[0]);
    if (key == null) {
      throw new IllegalStateException("Stored credential was sealed with unknown key " + parts[0]);
    }
    try {
      Cipher cipher = cipher(Cipher.DECRYPT_MODE, key, Base64.getDecoder().decode(parts[1]), providerId);
      byte[] opened = cipher.doFinal(Base64.getDecoder().decode(parts[2]));
      return new String(opened, StandardCharsets.UTF_8);
    } catch (GeneralSecurityException | IllegalArgumentException ex) {
      throw new IllegalStateException("Failed to open stored credential", ex);
    }
  }

  /** True when the value was sealed under a retired key and should be sealed again. */
  public boolean needsResealing(String sealedCredential) {
    return sealedCredential != null && !sealedCredential.startsWith(activeKeyId + ":");
  }

  private static Cipher cipher(int mode, SecretKey key, byte[] iv, String providerId)
      throws GeneralSecurityException {
    Cipher cipher = Cipher.getInstance(TRANSFORMATION);
    cipher.init(mode, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
    cipher.updateAAD(providerId.getBytes(StandardCharsets.UTF_8));
    return cipher;
  }

  private static SecretKey toKey(String secret, String property) {
    if (secret == null || secret.isBlank()) {
      throw new IllegalStateException(property + " is required");
    }
    byte[] keyBytes;
    try {
      keyBytes = Base64.getDecoder().decode(secret.trim());
    } catch (IllegalArgumentException ex) {
      throw new IllegalStateException(property + " is not valid base64", ex);
    }
    if (keyBytes.length != 16 && keyBytes.length != 24 && keyBytes.length != 32) {
      throw new IllegalStateException(property + " must decode to a 128, 192 or 256 bit key");
    }
    return new SecretKeySpec(keyBytes, "AES");
  }

  // First four bytes of the key's SHA-256, enough to tell configured keys apart.
  private static String keyId(SecretKey key) {
    try {
      byte[] digest = MessageDigest.getInstance("SHA-256").digest(key.getEncoded());
      return HexFormat.of().formatHex(digest, 0, 4);
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("SHA-256 is unavailable", ex);
    }
  }
}
