package com.codeheadsystems.keymanager.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.keymanager.client.accessor.KeyBundleAccessor;
import com.codeheadsystems.keymanager.client.manager.KeyBundleClientManager;
import com.codeheadsystems.keymanager.client.model.ServerConnectionInfo;
import com.codeheadsystems.keymanager.client.model.VerifiedKeyBundle;
import com.codeheadsystems.keymanager.client.verifier.KeyBundleVerifier;
import com.codeheadsystems.keymanager.crypto.KeyMaterialFactory;
import com.codeheadsystems.keymanager.model.KeyStatusResponse;
import com.codeheadsystems.keymanager.server.manager.KeyManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import jakarta.ws.rs.core.Response;
import java.net.URI;
import java.net.http.HttpClient;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Starts an embedded Jetty server with the bundle and fetches bundles through the real client.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class KeyManagerBundleIntegrationTest {

  static final DropwizardAppExtension<KeyManagerConfiguration> APP =
      new DropwizardAppExtension<>(
          KeyManagerTestApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private KeyBundleAccessor accessor;
  private KeyBundleClientManager clientManager;

  @BeforeEach
  void setUp() {
    ServerConnectionInfo connection =
        new ServerConnectionInfo(URI.create(String.format("http://localhost:%d/", APP.getLocalPort())));
    accessor = new KeyBundleAccessor(HttpClient.newHttpClient(), new ObjectMapper(), connection);
    clientManager = new KeyBundleClientManager(accessor, new KeyBundleVerifier(new KeyMaterialFactory()));
  }

  // ── Health check ─────────────────────────────────────────────────────────

  @Test
  void healthCheckReportsHealthy() {
    Response response = APP.client()
        .target(String.format("http://localhost:%d/healthcheck", APP.getAdminPort()))
        .request()
        .get();

    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(response.readEntity(String.class)).contains("key-manager");
  }

  // ── Publication ──────────────────────────────────────────────────────────

  @Test
  void bootstrapAccountPublishesVerifiableBundle() {
    Optional<VerifiedKeyBundle> bundle = clientManager.fetchVerified("alice");

    assertThat(bundle).isPresent();
    assertThat(bundle.get().registrationId()).isBetween(1, 16380);
    assertThat(bundle.get().oneTimePreKeys()).hasSize(4);
  }

  @Test
  void publishedBundleMatchesLocalIdentity() {
    KeyManager keyManager = keyManager();

    VerifiedKeyBundle bundle = clientManager.fetchVerified("alice").orElseThrow();

    assertThat(bundle.identityKey()).isEqualTo(keyManager.getIdentityKeyPair("alice").publicKey());
    assertThat(bundle.registrationId()).isEqualTo(keyManager.getRegistrationId("alice"));
  }

  @Test
  void unknownAccountHasNoBundle() {
    assertThat(clientManager.fetchVerified("mallory")).isEmpty();
  }

  @Test
  void statusReportsReadyAccount() {
    KeyStatusResponse status = accessor.status("alice");

    assertThat(status.accountId()).isEqualTo("alice");
    assertThat(status.state()).isEqualTo("READY");
    assertThat(status.signedPreKeyState()).isEqualTo("CURRENT");
    assertThat(status.activeSignedPreKeyId()).isPositive();
    assertThat(status.unusedPreKeys()).isGreaterThanOrEqualTo(5);
  }

  @Test
  void statusReportsUninitializedAccount() {
    KeyStatusResponse status = accessor.status("nobody");

    assertThat(status.state()).isEqualTo("UNINITIALIZED");
    assertThat(status.activeSignedPreKeyId()).isEqualTo(-1);
  }

  @Test
  void consumedPreKeyDisappearsFromLaterBundles() {
    KeyManager keyManager = keyManager();
    int consumed = clientManager.fetchVerified("alice").orElseThrow().oneTimePreKeys().get(0).keyId();

    assertThat(keyManager.consumePreKey("alice", consumed).publicKey()).isNotNull();

    assertThat(clientManager.fetchVerified("alice").orElseThrow().oneTimePreKeys())
        .extracting(VerifiedKeyBundle.OneTimePreKey::keyId)
        .doesNotContain(consumed);
  }

  private KeyManager keyManager() {
    KeyManagerTestApplication application = APP.getApplication();
    return application.bundle().getKeyManager();
  }
}
