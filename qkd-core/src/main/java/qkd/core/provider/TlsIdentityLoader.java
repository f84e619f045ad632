package qkd.core.provider;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.PrivateKey;
import java.security.Security;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.openssl.jcajce.JcaPKCS8Generator;
import org.bouncycastle.util.io.pem.PemObject;

import io.vertx.core.buffer.Buffer;

/**
 * Reads SAE certificates and keys from PEM files with BouncyCastle. Keys in
 * traditional (PKCS#1 / SEC1) or PKCS#8 form are normalised to unencrypted
 * PKCS#8 PEM, which is what the Vert.x TLS layer accepts.
 */
public final class TlsIdentityLoader
{
  private TlsIdentityLoader()
  {
  }

  public static PrivateKey loadPrivateKey( Path keyPath ) throws IOException
  {
    if( Security.getProvider( BouncyCastleProvider.PROVIDER_NAME ) == null )
      Security.addProvider( new BouncyCastleProvider() );

    try( Reader reader = Files.newBufferedReader( keyPath, StandardCharsets.US_ASCII );
         PEMParser pemParser = new PEMParser( reader ) )
    {
      Object             object    = pemParser.readObject();
      JcaPEMKeyConverter converter = new JcaPEMKeyConverter().setProvider( BouncyCastleProvider.PROVIDER_NAME );

      if( object == null )
        throw new IOException( "No PEM object in " + keyPath );
      if( object instanceof PEMEncryptedKeyPair )
        throw new IOException( "Encrypted private keys are not supported: " + keyPath );
      if( object instanceof PEMKeyPair keyPair )
        return converter.getPrivateKey( keyPair.getPrivateKeyInfo() );
      if( object instanceof PrivateKeyInfo keyInfo )
        return converter.getPrivateKey( keyInfo );

      throw new IOException( "Unsupported PEM object " + object.getClass().getSimpleName() + " in " + keyPath );
    }
  }

  public static Buffer privateKeyAsPkcs8Pem( Path keyPath ) throws IOException
  {
    PrivateKey   key = loadPrivateKey( keyPath );
    StringWriter out = new StringWriter();

    try( JcaPEMWriter writer = new JcaPEMWriter( out ) )
    {
      PemObject pem = new JcaPKCS8Generator( key, null ).generate();
      writer.writeObject( pem );
    }

    return Buffer.buffer( out.toString(), StandardCharsets.US_ASCII.name() );
  }

  /**
   * Reads a PEM certificate (chain) and fails early if the first entry is
   * not an X.509 certificate.
   */
  public static Buffer certificatePem( Path certPath ) throws IOException
  {
    byte[] pem = Files.readAllBytes( certPath );

    try( Reader reader = Files.newBufferedReader( certPath, StandardCharsets.US_ASCII );
         PEMParser pemParser = new PEMParser( reader ) )
    {
      if( !( pemParser.readObject() instanceof X509CertificateHolder ) )
        throw new IOException( "No X.509 certificate in " + certPath );
    }

    return Buffer.buffer( pem );
  }
}
