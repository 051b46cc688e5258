package com.codeheadsystems.keymanager.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.keymanager.server.exceptions.KeyStorageException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TimeBoundedAccountKeyStoreTest {

  private static final String ACCOUNT = "alice";

  @Mock private AccountKeyStore delegate;
  private TimeBoundedAccountKeyStore store;

  @BeforeEach
  void setUp() {
    store = new TimeBoundedAccountKeyStore(delegate, Duration.ofMillis(200));
  }

  @AfterEach
  void tearDown() {
    store.close();
  }

  @Test
  void delegatesResults() {
    IdentityRecord record = new IdentityRecord(new byte[]{1}, new byte[]{2}, 3, Instant.EPOCH);
    when(delegate.loadIdentityBundle(ACCOUNT)).thenReturn(Optional.of(record));
    when(delegate.markPreKeyUsed(ACCOUNT, 4)).thenReturn(true);
    when(delegate.listAccounts()).thenReturn(List.of(ACCOUNT));

    assertThat(store.loadIdentityBundle(ACCOUNT)).contains(record);
    assertThat(store.markPreKeyUsed(ACCOUNT, 4)).isTrue();
    assertThat(store.listAccounts()).containsExactly(ACCOUNT);
  }

  @Test
  void delegatesVoidCalls() {
    IdentityRecord record = new IdentityRecord(new byte[]{1}, new byte[]{2}, 3, Instant.EPOCH);

    store.upsertIdentityBundle(ACCOUNT, record);

    verify(delegate).upsertIdentityBundle(ACCOUNT, record);
  }

  @Test
  void slowCall_timesOutAsKeyStorageException() {
    when(delegate.countUnusedPreKeys(ACCOUNT)).thenAnswer(invocation -> {
      Thread.sleep(5_000);
      return 0;
    });

    assertThatThrownBy(() -> store.countUnusedPreKeys(ACCOUNT))
        .isInstanceOf(KeyStorageException.class)
        .hasMessageContaining("countUnusedPreKeys")
        .hasMessageContaining("timed out");
  }

  @Test
  void runtimeFailure_propagatesUnchanged() {
    when(delegate.reserveSignedPreKeyId(ACCOUNT)).thenThrow(new KeyStorageException("disk full"));

    assertThatThrownBy(() -> store.reserveSignedPreKeyId(ACCOUNT))
        .isInstanceOf(KeyStorageException.class)
        .hasMessage("disk full");
  }
}
