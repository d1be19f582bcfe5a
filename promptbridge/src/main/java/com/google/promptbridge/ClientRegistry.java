/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package com.google.promptbridge;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.promptbridge.core.PromptBridgeException;

/**
 * ClientRegistry provides thread-safe storage and lookup of prompt clients by
 * identifier.
 */
public class ClientRegistry {

  private static final Logger logger = LoggerFactory.getLogger(ClientRegistry.class);

  private final Map<String, PromptClient> clients = new ConcurrentHashMap<>();

  /**
   * Registers a client.
   *
   * @param client
   *            the client
   * @throws IllegalStateException
   *             if a client with the same identifier is registered
   */
  public void register(PromptClient client) {
    if (clients.putIfAbsent(client.getIdentifier(), client) != null) {
      throw new IllegalStateException("Client already registered: " + client.getIdentifier());
    }
    logger.debug("Registered client: {}", client.getIdentifier());
  }

  /**
   * Looks up a client.
   *
   * @param identifier
   *            the client identifier
   * @return the client, or null if none is registered
   */
  public PromptClient lookup(String identifier) {
    return identifier != null ? clients.get(identifier) : null;
  }

  /**
   * Returns a registered client.
   *
   * @param identifier
   *            the client identifier
   * @return the client
   * @throws PromptBridgeException
   *             with code CLIENT_NOT_CONFIGURED if no client is registered
   *             under the identifier
   */
  public PromptClient require(String identifier) throws PromptBridgeException {
    PromptClient client = lookup(identifier);
    if (client == null) {
      List<String> available = listClients();
      String hint = available.isEmpty()
          ? "No clients are registered."
          : "Available clients: " + available;
      throw PromptBridgeException.builder().message("Client " + identifier + " not configured. " + hint)
          .errorCode(PromptBridgeException.CLIENT_NOT_CONFIGURED).details(available).build();
    }
    return client;
  }

  public List<String> listClients() {
    List<String> names = new ArrayList<>(clients.keySet());
    names.sort(null);
    return names;
  }
}
