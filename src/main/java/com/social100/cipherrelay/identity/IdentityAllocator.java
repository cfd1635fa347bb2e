package com.social100.cipherrelay.identity;

import com.social100.cipherrelay.error.ResourceException;
import java.security.SecureRandom;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out random identities that are not currently reserved.
 *
 * <p>An identity stays reserved from {@link #allocate()} until {@link #release(Identity)}. The
 * reservation set is the single source of truth for uniqueness: two concurrent calls can never
 * return the same identity because the claim is an atomic set insertion.</p>
 *
 * <p>Allocation refuses with {@code ExhaustedNamespace} once the reserved count reaches
 * 15/16 of the identifier space, or when {@code maxAttempts} consecutive candidates collide.</p>
 */
public class IdentityAllocator {

  private static final Logger LOGGER = LoggerFactory.getLogger(IdentityAllocator.class);

  private final Set<Identity> reserved = ConcurrentHashMap.newKeySet();
  private final String alphabet;
  private final int length;
  private final int maxAttempts;
  private final Random random;
  private final long capacity;
  private final long reservationLimit;

  public IdentityAllocator(int maxAttempts) {
    this(Identity.ALPHABET, Identity.LENGTH, maxAttempts, new SecureRandom());
  }

  public IdentityAllocator(String alphabet, int length, int maxAttempts, Random random) {
    if (alphabet == null || alphabet.isEmpty()) {
      throw new IllegalArgumentException("alphabet must not be empty");
    }
    if (length <= 0) {
      throw new IllegalArgumentException("length must be positive");
    }
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be positive");
    }
    this.alphabet = alphabet;
    this.length = length;
    this.maxAttempts = maxAttempts;
    this.random = random;
    this.capacity = capacityOf(alphabet.length(), length);
    this.reservationLimit = Math.max(1, capacity - capacity / 16);
  }

  /**
   * Reserves and returns a fresh identity.
   *
   * @throws ResourceException with {@code ExhaustedNamespace} if no identity could be claimed
   */
  public Identity allocate() {
    if (reserved.size() >= reservationLimit) {
      throw ResourceException.exhaustedNamespace(reserved.size(), capacity);
    }
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      Identity candidate = new Identity(nextCandidate());
      if (reserved.add(candidate)) {
        if (attempt > 1) {
          LOGGER.debug("Allocated {} after {} collisions", candidate, attempt - 1);
        }
        return candidate;
      }
    }
    LOGGER.warn("Gave up allocating an identity after {} collisions ({} reserved)", maxAttempts, reserved.size());
    throw ResourceException.exhaustedNamespace(reserved.size(), capacity);
  }

  /**
   * Makes an identity available again. Releasing an identity that is not reserved is a no-op.
   */
  public void release(Identity identity) {
    if (reserved.remove(identity)) {
      LOGGER.debug("Released identity {}", identity);
    }
  }

  public boolean isReserved(Identity identity) {
    return reserved.contains(identity);
  }

  public int reservedCount() {
    return reserved.size();
  }

  public long capacity() {
    return capacity;
  }

  private String nextCandidate() {
    char[] chars = new char[length];
    for (int i = 0; i < length; i++) {
      chars[i] = alphabet.charAt(random.nextInt(alphabet.length()));
    }
    return new String(chars);
  }

  private static long capacityOf(int alphabetSize, int length) {
    long result = 1;
    for (int i = 0; i < length; i++) {
      result = Math.multiplyExact(result, alphabetSize);
    }
    return result;
  }
}
