/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.client;

import org.opensearch.core.action.ActionListener;

import io.saimon.ad.model.ModelRegistration;

/**
 * External catalogue of trained models.
 */
public interface ModelRegistry {

    /**
     * Registers a trained model. Registration is not idempotent: registering the same model
     * twice creates two entries.
     *
     * @param registration model to register
     * @param listener onResponse is called with the id the registry assigned (null if it did
     *                 not return one); onFailure with a RegistryUnavailableException
     */
    void register(ModelRegistration registration, ActionListener<String> listener);
}
