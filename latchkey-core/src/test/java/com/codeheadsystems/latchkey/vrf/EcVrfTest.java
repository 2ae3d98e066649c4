package com.codeheadsystems.latchkey.vrf;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.latchkey.exceptions.InvalidProofException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

/**
 * RFC 9381 appendix B.1 vectors for ECVRF-P256-SHA256-TAI.
 */
class EcVrfTest {

  private static final BigInteger SK = new BigInteger(
      "c9afa9d845ba75166b5c215767b1d6934e50c3db36e89b127b8a622b120f6721", 16);
  private static final String PK = "0360fed4ba255a9d31c961eb74c6356d68c049b8923b61fa6ce669622e60f29fb6";

  private final EcVrf vrf = new EcVrf(Curve.P256_CURVE);

  @Test
  void publicKey_matchesVector() {
    assertThat(Hex.toHexString(vrf.publicKey(SK))).isEqualTo(PK);
  }

  @Test
  void prove_sample() {
    byte[] alpha = "sample".getBytes(StandardCharsets.US_ASCII);
    byte[] pi = vrf.prove(SK, alpha);

    assertThat(Hex.toHexString(pi)).isEqualTo(
        "035b5c726e8c0e2c488a107c600578ee75cb702343c153cb1eb8dec77f4b5071b4"
            + "a53f0a46f018bc2c56e58d383f2305e0"
            + "975972c26feea0eb122fe7893c15af376b33edf7de17c6ea056d4d82de6bc02f");
    assertThat(Hex.toHexString(vrf.proofToHash(pi)))
        .isEqualTo("a3ad7b0ef73d8fc6655053ea22f9bede8c743f08bbed3d38821f0e16474b505e");
    assertThat(vrf.verify(Hex.decode(PK), pi, alpha)).isEqualTo(vrf.proofToHash(pi));
  }

  @Test
  void prove_test() {
    byte[] alpha = "test".getBytes(StandardCharsets.US_ASCII);
    byte[] pi = vrf.prove(SK, alpha);

    assertThat(Hex.toHexString(pi)).isEqualTo(
        "034dac60aba508ba0c01aa9be80377ebd7562c4a52d74722e0abae7dc3080ddb56"
            + "c19e067b15a8a8174905b13617804534"
            + "214f935b94c2287f797e393eb0816969d864f37625b443f30f1a5a33f2b3c854");
    assertThat(Hex.toHexString(vrf.proofToHash(pi)))
        .isEqualTo("a284f94ceec2ff4b3794629da7cbafa49121972671b466cab4ce170aa365f26d");
  }

  @Test
  void verify_wrongAlphaFails() {
    byte[] pi = vrf.prove(SK, "sample".getBytes(StandardCharsets.US_ASCII));

    assertThatThrownBy(() -> vrf.verify(Hex.decode(PK), pi, "sampLe".getBytes(StandardCharsets.US_ASCII)))
        .isInstanceOf(InvalidProofException.class);
  }

  @Test
  void verify_wrongLengthFails() {
    assertThatThrownBy(() -> vrf.verify(Hex.decode(PK), new byte[10], new byte[0]))
        .isInstanceOf(InvalidProofException.class)
        .hasMessageContaining("81 bytes");
  }

  @Test
  void verify_garbagePublicKeyFails() {
    byte[] pi = vrf.prove(SK, new byte[0]);
    byte[] badKey = new byte[33];
    badKey[0] = 0x05;

    assertThatThrownBy(() -> vrf.verify(badKey, pi, new byte[0]))
        .isInstanceOf(InvalidProofException.class)
        .hasMessage("Invalid VRF public key");
  }
}
