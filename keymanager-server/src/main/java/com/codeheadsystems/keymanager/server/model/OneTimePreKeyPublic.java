package com.codeheadsystems.keymanager.server.model;

import com.codeheadsystems.keymanager.crypto.model.PreKeyPublicKey;

public record OneTimePreKeyPublic(int keyId, PreKeyPublicKey publicKey) {
}
