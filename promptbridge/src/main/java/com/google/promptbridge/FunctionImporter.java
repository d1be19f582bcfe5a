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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.promptbridge.core.PromptBridgeException;

/**
 * FunctionImporter generates resource actions from client functions.
 *
 * <p>
 * Each imported function {@code ExtractTasks} yields a single-shot action
 * {@code extract_tasks} and a streaming action {@code extract_tasks_stream}. An
 * action already defined under either name is kept as defined.
 */
public final class FunctionImporter {

  private static final Logger logger = LoggerFactory.getLogger(FunctionImporter.class);

  static final String STREAM_SUFFIX = "_stream";

  private FunctionImporter() {
    // Utility class
  }

  /**
   * Merges imported actions into a set of explicit actions.
   *
   * @param client
   *            the client exposing the functions
   * @param functionNames
   *            the functions to import
   * @param explicit
   *            actions defined explicitly on the resource
   * @return the explicit actions followed by the generated ones
   * @throws PromptBridgeException
   *             with code FUNCTION_NOT_FOUND if the client does not expose a
   *             function
   */
  public static Map<String, ActionDefinition> importFunctions(PromptClient client, List<String> functionNames,
      Map<String, ActionDefinition> explicit) throws PromptBridgeException {
    Map<String, ActionDefinition> actions = new LinkedHashMap<>(explicit);
    for (String functionName : functionNames) {
      if (!client.exposes(functionName)) {
        throw PromptBridgeException.builder()
            .message("Function " + functionName + " not found in client " + client.getIdentifier() + ".\n\n"
                + "Available functions: " + client.getFunctionNames() + "\n\n"
                + "Make sure the function is defined in the client's prompt sources.")
            .errorCode(PromptBridgeException.FUNCTION_NOT_FOUND).details(functionName).build();
      }
      String actionName = toActionName(functionName);
      addIfAbsent(actions, ActionDefinition.builder().name(actionName).functionName(functionName)
          .kind(ActionDefinition.Kind.CALL).returnVariants(client.getReturnVariants(functionName))
          .description("Generated from function " + functionName).build());
      addIfAbsent(actions, ActionDefinition.builder().name(actionName + STREAM_SUFFIX).functionName(functionName)
          .kind(ActionDefinition.Kind.STREAM).description("Generated from function " + functionName).build());
    }
    return actions;
  }

  /**
   * Converts a function name to an action name: {@code ExtractTasks} becomes
   * {@code extract_tasks}, {@code HTTPRequest} becomes {@code http_request}.
   *
   * @param functionName
   *            the function name
   * @return the snake_case action name
   */
  public static String toActionName(String functionName) {
    return functionName.replaceAll("([A-Z]+)([A-Z][a-z])", "$1_$2").replaceAll("([a-z\\d])([A-Z])", "$1_$2")
        .replace('-', '_').toLowerCase(Locale.ROOT);
  }

  private static void addIfAbsent(Map<String, ActionDefinition> actions, ActionDefinition action) {
    if (actions.containsKey(action.getName())) {
      logger.debug("Action {} already defined, not generating it", action.getName());
      return;
    }
    actions.put(action.getName(), action);
  }
}
