package com.codeheadsystems.keymanager.server.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.codeheadsystems.keymanager.crypto.model.IdentityPublicKey;
import com.codeheadsystems.keymanager.crypto.model.PreKeyPublicKey;
import com.codeheadsystems.keymanager.model.KeyStatusResponse;
import com.codeheadsystems.keymanager.model.PublishedKeyBundle;
import com.codeheadsystems.keymanager.server.exceptions.KeyStorageException;
import com.codeheadsystems.keymanager.server.manager.KeyManager;
import com.codeheadsystems.keymanager.server.model.AccountKeyStatus;
import com.codeheadsystems.keymanager.server.model.AccountState;
import com.codeheadsystems.keymanager.server.model.KeyBundle;
import com.codeheadsystems.keymanager.server.model.OneTimePreKeyPublic;
import com.codeheadsystems.keymanager.server.model.PoolHealth;
import com.codeheadsystems.keymanager.server.model.SignedPreKeyFreshness;
import com.codeheadsystems.keymanager.server.model.SignedPreKeyPublic;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.RuntimeDelegate;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class KeyBundleResourceTest {

  private static final String ACCOUNT = "alice";
  private static final AtomicInteger LAST_STATUS = new AtomicInteger();

  @Mock private KeyManager keyManager;
  private KeyBundleResource resource;

  @BeforeAll
  static void installRuntimeDelegate() {
    // WebApplicationException needs a RuntimeDelegate to build its Response. The builder remembers
    // the last status it was given so each test can check the code it expects.
    Response.ResponseBuilder builder = mock(Response.ResponseBuilder.class, invocation -> {
      String name = invocation.getMethod().getName();
      if (name.equals("status")) {
        Object arg = invocation.getArgument(0);
        LAST_STATUS.set(arg instanceof Response.StatusType type ? type.getStatusCode() : (Integer) arg);
      }
      if (name.equals("build")) {
        int status = LAST_STATUS.get();
        return mock(Response.class, i -> {
          String method = i.getMethod().getName();
          if (method.equals("getStatus")) {
            return status;
          }
          return method.equals("toString") ? "response" : null;
        });
      }
      if (name.equals("toString")) {
        return "builder";
      }
      return invocation.getMethod().getReturnType().isInstance(invocation.getMock()) ? invocation.getMock() : null;
    });
    RuntimeDelegate delegate = mock(RuntimeDelegate.class);
    when(delegate.createResponseBuilder()).thenReturn(builder);
    RuntimeDelegate.setInstance(delegate);
  }

  @AfterAll
  static void removeRuntimeDelegate() {
    RuntimeDelegate.setInstance(null);
  }

  @BeforeEach
  void setUp() {
    resource = new KeyBundleResource(keyManager);
  }

  @Test
  void bundle_returnsPublishedForm() {
    KeyBundle bundle = new KeyBundle(
        new IdentityPublicKey(new byte[]{2, 1}),
        1234,
        new SignedPreKeyPublic(3, new PreKeyPublicKey(new byte[]{2, 2}), new byte[]{9, 9}),
        List.of(new OneTimePreKeyPublic(7, new PreKeyPublicKey(new byte[]{3, 3}))));
    when(keyManager.getPublicBundleForPublishing(ACCOUNT)).thenReturn(Optional.of(bundle));

    PublishedKeyBundle published = resource.bundle(ACCOUNT);

    assertThat(published.identityKey()).containsExactly(2, 1);
    assertThat(published.registrationId()).isEqualTo(1234);
    assertThat(published.signedPreKey().keyId()).isEqualTo(3);
    assertThat(published.signedPreKey().signature()).containsExactly(9, 9);
    assertThat(published.oneTimePreKeys()).hasSize(1);
    assertThat(published.oneTimePreKeys().get(0).keyId()).isEqualTo(7);
    assertThat(published.oneTimePreKeys().get(0).publicKey()).containsExactly(3, 3);
  }

  @Test
  void bundle_unavailable_throwsNotFound() {
    when(keyManager.getPublicBundleForPublishing(ACCOUNT)).thenReturn(Optional.empty());

    assertStatus(() -> resource.bundle(ACCOUNT), Response.Status.NOT_FOUND);
  }

  @Test
  void bundle_invalidAccount_throwsBadRequest() {
    when(keyManager.getPublicBundleForPublishing(" ")).thenThrow(new IllegalArgumentException("blank"));

    assertStatus(() -> resource.bundle(" "), Response.Status.BAD_REQUEST);
  }

  @Test
  void bundle_storeFailure_throwsServiceUnavailable() {
    when(keyManager.getPublicBundleForPublishing(ACCOUNT)).thenThrow(new KeyStorageException("down"));

    assertStatus(() -> resource.bundle(ACCOUNT), Response.Status.SERVICE_UNAVAILABLE);
  }

  @Test
  void status_mapsEnumsAndDeadline() {
    Instant deadline = Instant.parse("2026-01-08T00:00:00Z");
    when(keyManager.getAccountStatus(ACCOUNT)).thenReturn(new AccountKeyStatus(
        ACCOUNT, AccountState.READY, 12, PoolHealth.LOW, 4, SignedPreKeyFreshness.CURRENT, deadline));

    KeyStatusResponse response = resource.status(ACCOUNT);

    assertThat(response).isEqualTo(new KeyStatusResponse(
        ACCOUNT, "READY", 12, "LOW", 4, "CURRENT", "2026-01-08T00:00:00Z"));
  }

  @Test
  void status_uninitializedAccountHasNoDeadline() {
    when(keyManager.getAccountStatus(ACCOUNT)).thenReturn(new AccountKeyStatus(
        ACCOUNT, AccountState.UNINITIALIZED, 0, PoolHealth.LOW, -1, SignedPreKeyFreshness.DUE_FOR_ROTATION, null));

    assertThat(resource.status(ACCOUNT).nextRotationAt()).isNull();
  }

  private void assertStatus(Runnable call, Response.Status expected) {
    assertThatThrownBy(call::run)
        .isInstanceOf(WebApplicationException.class)
        .satisfies(e -> assertThat(((WebApplicationException) e).getResponse().getStatus())
            .isEqualTo(expected.getStatusCode()));
  }
}
