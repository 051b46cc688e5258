package com.codeheadsystems.keymanager.dropwizard;

import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Minimal application embedding the bundle with the in-memory store.
 */
public class KeyManagerTestApplication extends Application<KeyManagerConfiguration> {

  private final KeyManagerBundle<KeyManagerConfiguration> bundle = new KeyManagerBundle<>();

  public static void main(String[] args) throws Exception {
    new KeyManagerTestApplication().run(args);
  }

  @Override
  public String getName() {
    return "key-manager-test";
  }

  @Override
  public void initialize(Bootstrap<KeyManagerConfiguration> bootstrap) {
    bootstrap.addBundle(bundle);
  }

  public KeyManagerBundle<KeyManagerConfiguration> bundle() {
    return bundle;
  }

  @Override
  public void run(KeyManagerConfiguration configuration, Environment environment) {
    // All wiring lives in the bundle
  }
}
