package com.codeheadsystems.keymanager.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class PublishedKeyBundleTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void constructor_fromBytes_encodesCorrectly() {
    byte[] identityKey = {2, 1, 2, 3};
    PublishedKeyBundle bundle = new PublishedKeyBundle(identityKey, 42,
        new PublishedSignedPreKey(7, new byte[]{3, 9}, new byte[]{5, 5}),
        List.of(new PublishedOneTimePreKey(1, new byte[]{2, 8})));

    assertThat(bundle.identityKey()).isEqualTo(identityKey);
    assertThat(bundle.signedPreKey().publicKey()).isEqualTo(new byte[]{3, 9});
    assertThat(bundle.signedPreKey().signature()).isEqualTo(new byte[]{5, 5});
    assertThat(bundle.oneTimePreKeys().get(0).publicKey()).isEqualTo(new byte[]{2, 8});
  }

  @Test
  void nullPreKeyList_becomesEmpty() {
    PublishedKeyBundle bundle = new PublishedKeyBundle("AgE=", 1,
        new PublishedSignedPreKey(1, "Ag==", "AQ=="), null);

    assertThat(bundle.oneTimePreKeys()).isEmpty();
  }

  @Test
  void identityKey_missingThrowsIAE() {
    PublishedKeyBundle bundle = new PublishedKeyBundle((String) null, 1, null, List.of());

    assertThatThrownBy(bundle::identityKey)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Missing required field: identityKey");
  }

  @Test
  void signature_invalidBase64ThrowsIAE() {
    PublishedSignedPreKey signedPreKey = new PublishedSignedPreKey(1, "Ag==", "@@@");

    assertThatThrownBy(signedPreKey::signature)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Invalid base64");
  }

  @Test
  void jsonUsesPublicationFieldNames() throws Exception {
    PublishedKeyBundle bundle = new PublishedKeyBundle(new byte[]{2, 4}, 9,
        new PublishedSignedPreKey(3, new byte[]{2}, new byte[]{1}),
        List.of(new PublishedOneTimePreKey(11, new byte[]{3})));

    String json = mapper.writeValueAsString(bundle);

    assertThat(json)
        .contains("\"identityKey\":\"AgQ=\"")
        .contains("\"registrationId\":9")
        .contains("\"signedPreKey\":{\"keyId\":3,\"publicKey\":\"Ag==\",\"signature\":\"AQ==\"}")
        .contains("\"oneTimePreKeys\":[{\"keyId\":11,\"publicKey\":\"Aw==\"}]");
  }

  @Test
  void jsonRoundTrip() throws Exception {
    PublishedKeyBundle original = new PublishedKeyBundle(new byte[33], 1234,
        new PublishedSignedPreKey(3, new byte[33], new byte[64]),
        List.of(new PublishedOneTimePreKey(1, new byte[33]), new PublishedOneTimePreKey(2, new byte[33])));

    PublishedKeyBundle restored = mapper.readValue(mapper.writeValueAsString(original), PublishedKeyBundle.class);

    assertThat(restored).isEqualTo(original);
  }
}
