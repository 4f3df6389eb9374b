package bio.terra.adminauth.signing;

/**
 * Signs token bytes on behalf of a principal. Implementations are safe for concurrent use.
 *
 * @see ServiceAccountSigner
 * @see IamSigner
 * @see EmulatedSigner
 */
public interface CryptoSigner {
  String ALGORITHM_RS256 = "RS256";

  /** JWS algorithm identifier written to the header of tokens this signer signs. */
  String getAlgorithm();

  byte[] sign(byte[] payload);

  /** The principal email used as issuer and subject of minted tokens. */
  String getEmail();
}
