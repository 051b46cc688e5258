package com.codeheadsystems.keymanager.server.resource;

import com.codeheadsystems.keymanager.model.KeyStatusResponse;
import com.codeheadsystems.keymanager.model.PublishedKeyBundle;
import com.codeheadsystems.keymanager.server.exceptions.KeyStorageException;
import com.codeheadsystems.keymanager.server.manager.KeyManager;
import com.codeheadsystems.keymanager.server.model.KeyBundle;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes public key bundles and key health of accounts.
 */
@Singleton
@Path("/keys")
@Produces(MediaType.APPLICATION_JSON)
public class KeyBundleResource {
  private static final Logger log = LoggerFactory.getLogger(KeyBundleResource.class);

  private final KeyManager keyManager;

  /**
   * Instantiates a new Key bundle resource.
   *
   * @param keyManager the key manager
   */
  @Inject
  public KeyBundleResource(final KeyManager keyManager) {
    this.keyManager = keyManager;
    log.info("KeyBundleResource({})", keyManager);
  }

  /**
   * Public key bundle of an account. 404 when the account has nothing publishable.
   *
   * @param accountId the account
   * @return the published bundle
   */
  @GET
  @Path("/{accountId}/bundle")
  public PublishedKeyBundle bundle(@PathParam("accountId") final String accountId) {
    log.trace("bundle(accountId={})", accountId);
    KeyBundle bundle = call(() -> keyManager.getPublicBundleForPublishing(accountId))
        .orElseThrow(() -> new WebApplicationException(
            "No key bundle available for account", Response.Status.NOT_FOUND));
    return bundle.toPublished();
  }

  /**
   * Key health of an account.
   *
   * @param accountId the account
   * @return the status
   */
  @GET
  @Path("/{accountId}/status")
  public KeyStatusResponse status(@PathParam("accountId") final String accountId) {
    log.trace("status(accountId={})", accountId);
    return call(() -> keyManager.getAccountStatus(accountId)).toResponse();
  }

  private <T> T call(Supplier<T> supplier) {
    try {
      return supplier.get();
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException("Invalid account id", Response.Status.BAD_REQUEST);
    } catch (KeyStorageException e) {
      log.warn("Key store unavailable: {}", e.getMessage());
      throw new WebApplicationException("Key store unavailable", Response.Status.SERVICE_UNAVAILABLE);
    }
  }
}
