package com.codeheadsystems.latchkey.shamir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.latchkey.common.RandomProvider;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class CommutativeCipherTest {

  private static final BigInteger M127 = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);

  private final CommutativeCipher cipher = new CommutativeCipher();

  @Test
  void defaultModulus_isRfc3526Group14() {
    assertThat(cipher.modulus()).isEqualTo(CommutativeCipher.RFC3526_MODP_2048);
    assertThat(cipher.modulus().bitLength()).isEqualTo(2048);
    assertThat(cipher.encodedLength()).isEqualTo(256);
  }

  @Test
  void locks_commute() {
    LockKeys client = cipher.generateLockKeys();
    LockKeys server = cipher.generateLockKeys();
    BigInteger value = cipher.randomKek();

    BigInteger clientFirst = cipher.addLock(cipher.addLock(value, client.encryptExponent()),
        server.encryptExponent());
    BigInteger serverFirst = cipher.addLock(cipher.addLock(value, server.encryptExponent()),
        client.encryptExponent());

    assertThat(clientFirst).isEqualTo(serverFirst);
  }

  @Test
  void threePass_recoversValue() {
    LockKeys client = cipher.generateLockKeys();
    LockKeys server = cipher.generateLockKeys();
    BigInteger value = cipher.randomKek();

    BigInteger pass1 = cipher.addLock(value, client.encryptExponent());
    BigInteger pass2 = cipher.addLock(pass1, server.encryptExponent());
    BigInteger pass3 = cipher.removeLock(pass2, client.decryptExponent());

    assertThat(pass3).isEqualTo(cipher.addLock(value, server.encryptExponent()));
    assertThat(cipher.removeLock(pass3, server.decryptExponent())).isEqualTo(value);
  }

  @Test
  void lockKeys_areInverseModPMinusOne() {
    LockKeys keys = cipher.generateLockKeys();
    BigInteger pMinusOne = cipher.modulus().subtract(BigInteger.ONE);

    assertThat(keys.encryptExponent().multiply(keys.decryptExponent()).mod(pMinusOne)).isEqualTo(BigInteger.ONE);
    assertThat(keys.encryptExponent()).isGreaterThanOrEqualTo(BigInteger.ONE.shiftLeft(64));
    assertThat(keys.toString()).doesNotContain(keys.decryptExponent().toString());
  }

  @Test
  void smallPrime_usesSmallerExponentFloor() {
    CommutativeCipher small = new CommutativeCipher(M127, new RandomProvider());
    BigInteger k = small.randomExponent();

    assertThat(k).isGreaterThanOrEqualTo(BigInteger.ONE.shiftLeft(32)).isLessThanOrEqualTo(M127.subtract(BigInteger.TWO));
    assertThat(k.gcd(M127.subtract(BigInteger.ONE))).isEqualTo(BigInteger.ONE);
    assertThat(small.encodedLength()).isEqualTo(16);
  }

  @Test
  void checkValue_rejectsFixedPoints() {
    BigInteger p = cipher.modulus();
    for (BigInteger bad : new BigInteger[]{BigInteger.ZERO, BigInteger.ONE, p.subtract(BigInteger.ONE), p}) {
      assertThatThrownBy(() -> cipher.checkValue(bad))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Value out of range for modulus");
    }
    cipher.checkValue(BigInteger.TWO);
    cipher.checkValue(p.subtract(BigInteger.TWO));
  }

  @Test
  void constructor_rejectsCompositeAndSmallModulus() {
    assertThatThrownBy(() -> new CommutativeCipher(M127.add(BigInteger.TWO), new RandomProvider()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Modulus is not prime");
    assertThatThrownBy(() -> new CommutativeCipher(BigInteger.valueOf(65537), new RandomProvider()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void decode_requiresFixedWidth() {
    assertThatThrownBy(() -> cipher.decode(new byte[10]))
        .isInstanceOf(IllegalArgumentException.class);
    BigInteger value = cipher.randomKek();
    assertThat(cipher.decode(cipher.encode(value))).isEqualTo(value);
  }

  @Test
  void keyId_isStableUrlSafeDigest() {
    LockKeys keys = cipher.generateLockKeys();
    String keyId = cipher.keyId(keys.encryptExponent());

    assertThat(keyId).hasSize(43).matches("[A-Za-z0-9_-]+");
    assertThat(cipher.keyId(keys.encryptExponent())).isEqualTo(keyId);
    assertThat(cipher.keyId(cipher.generateLockKeys().encryptExponent())).isNotEqualTo(keyId);
  }

  @Test
  void seal_wrongKekFails() {
    BigInteger kek = cipher.randomKek();
    byte[] box = cipher.seal(kek, "secret".getBytes(StandardCharsets.UTF_8));

    assertThat(cipher.open(kek, box)).asString(StandardCharsets.UTF_8).isEqualTo("secret");
    assertThatThrownBy(() -> cipher.open(kek.add(BigInteger.ONE), box))
        .isInstanceOf(SecurityException.class)
        .hasMessage("Authentication failed");
  }
}
