package com.cgraph.auth.crypto.wallet;

import com.cgraph.auth.crypto.common.ByteUtils;
import com.cgraph.auth.crypto.common.CryptoException;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Optional;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.asn1.x9.X9IntegerConverter;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECAlgorithms;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.bouncycastle.util.encoders.Hex;

/**
 * secp256k1 public-key recovery and Ethereum address derivation.
 * <p>
 * Recovery follows SEC 1 v2 section 4.1.6: the candidate point R is rebuilt from r and the
 * recovery id, then Q = r^-1 (sR - eG).
 */
public final class Secp256k1 {

  private static final X9ECParameters PARAMS = CustomNamedCurves.getByName("secp256k1");
  private static final ECDomainParameters CURVE = new ECDomainParameters(
      PARAMS.getCurve(), PARAMS.getG(), PARAMS.getN(), PARAMS.getH());
  private static final BigInteger HALF_N = CURVE.getN().shiftRight(1);
  private static final int ADDRESS_BYTES = 20;

  private Secp256k1() {
  }

  /**
   * Recovers the signer's public key from a message hash and signature.
   *
   * @param hash      the 32 byte digest that was signed
   * @param signature the signature
   * @return the public key point, or empty if no valid key can be recovered
   */
  public static Optional<ECPoint> recoverPublicKey(byte[] hash, RecoverableSignature signature) {
    BigInteger n = CURVE.getN();
    BigInteger r = signature.r();
    BigInteger s = signature.s();
    if (r.signum() <= 0 || r.compareTo(n) >= 0 || s.signum() <= 0 || s.compareTo(n) >= 0) {
      return Optional.empty();
    }
    int recId = signature.recoveryId();
    BigInteger x = r.add(BigInteger.valueOf(recId / 2).multiply(n));
    BigInteger prime = CURVE.getCurve().getField().getCharacteristic();
    if (x.compareTo(prime) >= 0) {
      return Optional.empty();
    }
    ECPoint rPoint;
    try {
      rPoint = decompress(x, (recId & 1) == 1);
    } catch (IllegalArgumentException e) {
      // x is not on the curve
      return Optional.empty();
    }
    if (!rPoint.multiply(n).isInfinity()) {
      return Optional.empty();
    }
    BigInteger e = new BigInteger(1, hash);
    BigInteger eInv = BigInteger.ZERO.subtract(e).mod(n);
    BigInteger rInv = r.modInverse(n);
    BigInteger srInv = rInv.multiply(s).mod(n);
    BigInteger eInvrInv = rInv.multiply(eInv).mod(n);
    ECPoint q = ECAlgorithms.sumOfTwoMultiplies(CURVE.getG(), eInvrInv, rPoint, srInv).normalize();
    if (q.isInfinity()) {
      return Optional.empty();
    }
    return Optional.of(q);
  }

  /**
   * Recovers the signer's address.
   *
   * @param hash      the 32 byte digest that was signed
   * @param signature the signature
   * @return lower-case {@code 0x} address, or empty if recovery fails
   */
  public static Optional<String> recoverAddress(byte[] hash, RecoverableSignature signature) {
    return recoverPublicKey(hash, signature).map(Secp256k1::addressOf);
  }

  /**
   * Address of a public key: the last 20 bytes of Keccak-256 over the uncompressed point without
   * its 0x04 format byte.
   *
   * @param publicKey the point
   * @return lower-case {@code 0x} address
   */
  public static String addressOf(ECPoint publicKey) {
    byte[] encoded = publicKey.normalize().getEncoded(false);
    byte[] hash = Keccak256.hash(Arrays.copyOfRange(encoded, 1, encoded.length));
    return "0x" + Hex.toHexString(ByteUtils.tail(hash, ADDRESS_BYTES));
  }

  /**
   * Address owned by a private key.
   *
   * @param privateKey the scalar
   * @return lower-case {@code 0x} address
   */
  public static String addressOf(BigInteger privateKey) {
    return addressOf(publicKeyOf(privateKey));
  }

  /**
   * Public key for a private scalar.
   *
   * @param privateKey the scalar
   * @return the point
   */
  public static ECPoint publicKeyOf(BigInteger privateKey) {
    return new FixedPointCombMultiplier().multiply(CURVE.getG(), privateKey.mod(CURVE.getN())).normalize();
  }

  /**
   * Signs a digest deterministically (RFC 6979) with a low-S signature and finds the matching
   * recovery id. This is the wallet side of the protocol.
   *
   * @param hash       32 byte digest
   * @param privateKey signer's scalar
   * @return recoverable signature
   */
  public static RecoverableSignature sign(byte[] hash, BigInteger privateKey) {
    ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
    signer.init(true, new ECPrivateKeyParameters(privateKey, CURVE));
    BigInteger[] components = signer.generateSignature(hash);
    BigInteger r = components[0];
    BigInteger s = components[1];
    if (s.compareTo(HALF_N) > 0) {
      s = CURVE.getN().subtract(s);
    }
    ECPoint expected = publicKeyOf(privateKey);
    for (int recId = 0; recId < 4; recId++) {
      Optional<ECPoint> candidate = recoverPublicKey(hash, new RecoverableSignature(r, s, recId));
      if (candidate.isPresent() && candidate.get().equals(expected)) {
        return new RecoverableSignature(r, s, recId);
      }
    }
    throw new CryptoException("Could not construct a recoverable signature");
  }

  private static ECPoint decompress(BigInteger x, boolean yOdd) {
    X9IntegerConverter converter = new X9IntegerConverter();
    byte[] encoded = converter.integerToBytes(x, 1 + converter.getByteLength(CURVE.getCurve()));
    encoded[0] = (byte) (yOdd ? 0x03 : 0x02);
    return CURVE.getCurve().decodePoint(encoded);
  }
}
