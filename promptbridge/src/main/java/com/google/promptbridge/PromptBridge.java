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

import com.google.promptbridge.ai.CallOptions;
import com.google.promptbridge.ai.FunctionCaller;
import com.google.promptbridge.ai.InvocationDescriptor;
import com.google.promptbridge.ai.Response;
import com.google.promptbridge.ai.stream.StreamingBridge;
import com.google.promptbridge.ai.telemetry.CallTelemetry;
import com.google.promptbridge.ai.telemetry.TelemetryConfig;
import com.google.promptbridge.core.CallResult;
import com.google.promptbridge.core.PromptBridgeException;
import com.google.promptbridge.core.telemetry.EventBus;

/**
 * PromptBridge is the main entry point for calling prompt functions through
 * resource actions.
 *
 * <pre>{@code
 * PromptBridge bridge = new PromptBridge();
 * bridge.registerClient(PromptClient.builder().identifier("todo").engine(engine).functions("ExtractTasks").build());
 * bridge.defineResource(BridgeResource.builder().name("Tasks").client("todo").importFunctions("ExtractTasks").build());
 *
 * CallResult<Response<Object>> result = bridge.call("Tasks", "extract_tasks", Map.of("input", text));
 * StreamingBridge.StreamHandle chunks = bridge.stream("Tasks", "extract_tasks_stream", Map.of("input", text))
 *     .getData();
 * }</pre>
 *
 * Single-shot calls are instrumented with telemetry and wrapped in a
 * {@link Response}. Streaming calls publish no telemetry events.
 */
public class PromptBridge {

  private static final Logger logger = LoggerFactory.getLogger(PromptBridge.class);

  private final PromptBridgeOptions options;
  private final ClientRegistry clients;
  private final Map<String, BridgeResource> resources;
  private final FunctionCaller caller;
  private final StreamingBridge streaming;

  /**
   * Creates a new PromptBridge with default options.
   */
  public PromptBridge() {
    this(PromptBridgeOptions.builder().build());
  }

  /**
   * Creates a new PromptBridge with the given options.
   *
   * @param options
   *            the options
   */
  public PromptBridge(PromptBridgeOptions options) {
    this(options, new CallTelemetry(options.getEventBus()));
  }

  PromptBridge(PromptBridgeOptions options, CallTelemetry telemetry) {
    this.options = options;
    this.clients = new ClientRegistry();
    this.resources = new ConcurrentHashMap<>();
    this.caller = new FunctionCaller(telemetry);
    this.streaming = StreamingBridge.builder().executor(options.getStreamExecutor())
        .readTimeout(options.getStreamReadTimeout()).maxDrain(options.getStreamMaxDrain())
        .cancelOnAbandon(options.isCancelStreamsOnAbandon()).build();
  }

  public PromptBridgeOptions getOptions() {
    return options;
  }

  public EventBus getEventBus() {
    return options.getEventBus();
  }

  public ClientRegistry getClients() {
    return clients;
  }

  /**
   * Registers a client.
   *
   * @param client
   *            the client
   * @return this bridge
   */
  public PromptBridge registerClient(PromptClient client) {
    clients.register(client);
    return this;
  }

  /**
   * Defines a resource. Imported functions are expanded into actions here.
   *
   * @param resource
   *            the resource
   * @return the resource with its generated actions
   * @throws PromptBridgeException
   *             if the client is not configured or does not expose an
   *             imported function
   */
  public BridgeResource defineResource(BridgeResource resource) throws PromptBridgeException {
    PromptClient client = clients.require(resource.getClient());
    BridgeResource resolved = resource.resolve(client);
    if (resources.putIfAbsent(resolved.getName(), resolved) != null) {
      throw new IllegalStateException("Resource already defined: " + resolved.getName());
    }
    logger.debug("Defined resource {} with actions {}", resolved.getName(), resolved.getActions().keySet());
    return resolved;
  }

  /**
   * Looks up a resource.
   *
   * @param name
   *            the resource name
   * @return the resource, or null
   */
  public BridgeResource getResource(String name) {
    return resources.get(name);
  }

  public List<BridgeResource> listResources() {
    return new ArrayList<>(resources.values());
  }

  /**
   * Runs a single-shot action.
   *
   * @param resource
   *            the resource name
   * @param action
   *            the action name
   * @param arguments
   *            the action arguments
   * @return the wrapped result, or the engine's error
   * @throws PromptBridgeException
   *             if the action does not exist or the engine fails
   */
  public CallResult<Response<Object>> call(String resource, String action, Map<String, Object> arguments)
      throws PromptBridgeException {
    return call(resource, action, arguments, Map.of());
  }

  /**
   * Runs a single-shot action with an invocation context.
   *
   * @param resource
   *            the resource name
   * @param action
   *            the action name
   * @param arguments
   *            the action arguments
   * @param context
   *            the invocation context, for example {@code llm_client}
   * @return the wrapped result, or the engine's error
   * @throws PromptBridgeException
   *             if the action does not exist or the engine fails
   */
  public CallResult<Response<Object>> call(String resource, String action, Map<String, Object> arguments,
      Map<String, Object> context) throws PromptBridgeException {
    BridgeResource definition = requireResource(resource);
    ActionDefinition actionDef = requireAction(definition, action, ActionDefinition.Kind.CALL);
    PromptClient client = clients.require(definition.getClient());
    if (!client.exposes(actionDef.getFunctionName())) {
      return CallResult.error(functionNotFound(definition, actionDef, client));
    }
    InvocationDescriptor descriptor = InvocationDescriptor.builder().functionName(actionDef.getFunctionName())
        .arguments(arguments).resource(definition.getName()).action(actionDef.getName())
        .telemetry(telemetryFor(definition)).context(context).context(TelemetryConfig.METADATA_STREAM, false)
        .returnVariants(actionDef.getReturnVariants()).build();
    return caller.call(client.getEngine(), descriptor);
  }

  /**
   * Prepares a streaming action. The engine is not called until the returned
   * handle is iterated.
   *
   * @param resource
   *            the resource name
   * @param action
   *            the action name
   * @param arguments
   *            the action arguments
   * @return the stream handle, or an error if the client does not expose the
   *         function
   * @throws PromptBridgeException
   *             if the action does not exist
   */
  public CallResult<StreamingBridge.StreamHandle> stream(String resource, String action,
      Map<String, Object> arguments) throws PromptBridgeException {
    BridgeResource definition = requireResource(resource);
    ActionDefinition actionDef = requireAction(definition, action, ActionDefinition.Kind.STREAM);
    PromptClient client = clients.require(definition.getClient());
    if (!client.exposes(actionDef.getFunctionName())) {
      return CallResult.error(functionNotFound(definition, actionDef, client));
    }
    return CallResult.ok(
        streaming.open(client.getEngine(), actionDef.getFunctionName(), arguments, CallOptions.none()));
  }

  private TelemetryConfig telemetryFor(BridgeResource resource) {
    return resource.getTelemetry() != null ? resource.getTelemetry() : options.defaultTelemetry();
  }

  private BridgeResource requireResource(String name) {
    BridgeResource resource = resources.get(name);
    if (resource == null) {
      throw PromptBridgeException.builder().message("Resource not found: " + name)
          .errorCode(PromptBridgeException.ACTION_NOT_FOUND).build();
    }
    return resource;
  }

  private ActionDefinition requireAction(BridgeResource resource, String name, ActionDefinition.Kind kind) {
    ActionDefinition action = resource.getAction(name);
    if (action == null) {
      throw PromptBridgeException.builder()
          .message("Action " + name + " not found on resource " + resource.getName() + ". Available actions: "
              + resource.getActions().keySet())
          .errorCode(PromptBridgeException.ACTION_NOT_FOUND).build();
    }
    if (action.getKind() != kind) {
      throw PromptBridgeException.builder()
          .message("Action " + name + " on resource " + resource.getName() + " is a " + action.getKind().getValue()
              + " action")
          .errorCode(PromptBridgeException.ACTION_NOT_FOUND).build();
    }
    return action;
  }

  static String functionNotFound(BridgeResource resource, ActionDefinition action, PromptClient client) {
    return "Prompt function not found: " + action.getFunctionName() + "\n\n"
        + "Resource: " + resource.getName() + "\n"
        + "Function: " + action.getFunctionName() + "\n"
        + "Client: " + client.getIdentifier() + "\n\n"
        + "Make sure:\n"
        + "1. The client's prompt sources define a function named " + action.getFunctionName() + "\n"
        + "2. The client (" + client.getIdentifier() + ") declares the function\n"
        + "3. The engine has loaded the client's prompt sources\n";
  }
}
