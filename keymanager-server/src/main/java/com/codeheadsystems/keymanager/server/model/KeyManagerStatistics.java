package com.codeheadsystems.keymanager.server.model;

/**
 * Process-wide counters since start.
 *
 * @param identityKeysGenerated identity key pairs created
 * @param preKeysGenerated      one-time pre-keys created
 * @param preKeysUsed           one-time pre-keys consumed
 * @param signedPreKeysRotated  signed pre-keys installed, the first one of each account included
 * @param encryptionOperations  seal and open operations of the key encryption unit
 */
public record KeyManagerStatistics(
    long identityKeysGenerated,
    long preKeysGenerated,
    long preKeysUsed,
    long signedPreKeysRotated,
    long encryptionOperations) {
}
