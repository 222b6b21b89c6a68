package com.github.fsm;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.fsm.MachineDefinition.MachineDefinitionBuilder;
import com.github.fsm.StateMachineException.Code;
import com.github.fsm.TransitionTable.TransitionTableBuilder;

/**
 * Builds {@link MachineDefinition}s from an external description so that machine shapes can live
 * in configuration files rather than in code. The description is a JSON object such as:
 *
 * <pre>
 * {
 *   "name": "news-workflow",
 *   "transitions": {
 *     "draft": ["awaiting_review", "rejected"],
 *     "awaiting_review": ["draft", "reviewed", "rejected"],
 *     "reviewed": ["published", "rejected"],
 *     "published": null,
 *     "rejected": ["draft"]
 *   },
 *   "default_state": "draft"
 * }
 * </pre>
 *
 * "allowed_transitions" is accepted in place of "transitions"; "name" is optional. A null or empty
 * list marks a terminal state. Any description that can't be turned into a valid transition table
 * and default state fails with {@link Code#MALFORMED_DEFINITION}, the underlying reason being kept
 * as the cause where there is one.
 *
 * Handlers can't be expressed in JSON; pass a {@link TransitionHandlers} registry built in code to
 * attach them to the loaded definition.
 */
public final class MachineDefinitionLoader {
  private static final Logger logger =
      LogManager.getLogger(MachineDefinitionLoader.class.getSimpleName());

  static final String TRANSITIONS = "transitions";
  static final String ALLOWED_TRANSITIONS = "allowed_transitions";
  static final String DEFAULT_STATE = "default_state";
  static final String NAME = "name";

  private final ObjectMapper mapper;

  public MachineDefinitionLoader() {
    this(new ObjectMapper().enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION));
  }

  public MachineDefinitionLoader(final ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public <T> MachineDefinition<T> load(final String json) throws StateMachineException {
    return load(null, json, TransitionHandlers.<T>none());
  }

  public <T> MachineDefinition<T> load(final String name, final String json,
      final TransitionHandlers<T> handlers) throws StateMachineException {
    if (json == null) {
      throw new StateMachineException(Code.MALFORMED_DEFINITION, "Definition document is null");
    }
    final JsonNode description;
    try {
      description = mapper.readTree(json);
    } catch (IOException problem) {
      throw new StateMachineException(Code.MALFORMED_DEFINITION,
          "Definition document is not valid JSON", problem);
    }
    return load(name, description, handlers);
  }

  public <T> MachineDefinition<T> load(final String name, final InputStream json,
      final TransitionHandlers<T> handlers) throws StateMachineException {
    if (json == null) {
      throw new StateMachineException(Code.MALFORMED_DEFINITION, "Definition stream is null");
    }
    final JsonNode description;
    try {
      description = mapper.readTree(json);
    } catch (IOException problem) {
      throw new StateMachineException(Code.MALFORMED_DEFINITION,
          "Definition document is not valid JSON", problem);
    }
    return load(name, description, handlers);
  }

  public <T> MachineDefinition<T> load(final Path path) throws StateMachineException {
    return load(null, path, TransitionHandlers.<T>none());
  }

  public <T> MachineDefinition<T> load(final String name, final Path path,
      final TransitionHandlers<T> handlers) throws StateMachineException {
    try (InputStream json = Files.newInputStream(path)) {
      return load(name, json, handlers);
    } catch (IOException problem) {
      throw new StateMachineException(Code.MALFORMED_DEFINITION,
          "Failed to read definition file " + path, problem);
    }
  }

  /**
   * Load a definition from a classpath resource, eg. "definitions/news-workflow.json".
   */
  public <T> MachineDefinition<T> loadResource(final String resource)
      throws StateMachineException {
    return loadResource(null, resource, TransitionHandlers.<T>none());
  }

  public <T> MachineDefinition<T> loadResource(final String name, final String resource,
      final TransitionHandlers<T> handlers) throws StateMachineException {
    final ClassLoader classLoader = MachineDefinitionLoader.class.getClassLoader();
    try (InputStream json = classLoader.getResourceAsStream(resource)) {
      if (json == null) {
        throw new StateMachineException(Code.MALFORMED_DEFINITION,
            "Definition resource not found: " + resource);
      }
      return load(name, json, handlers);
    } catch (IOException problem) {
      throw new StateMachineException(Code.MALFORMED_DEFINITION,
          "Failed to read definition resource " + resource, problem);
    }
  }

  /**
   * Load a definition from an already parsed structure, eg. a map produced by another
   * configuration library.
   */
  public <T> MachineDefinition<T> load(final String name, final Map<String, ?> description,
      final TransitionHandlers<T> handlers) throws StateMachineException {
    if (description == null) {
      throw new StateMachineException(Code.MALFORMED_DEFINITION, "Definition is null");
    }
    final JsonNode tree;
    try {
      tree = mapper.valueToTree(description);
    } catch (IllegalArgumentException problem) {
      throw new StateMachineException(Code.MALFORMED_DEFINITION,
          "Definition cannot be converted to a JSON tree", problem);
    }
    return load(name, tree, handlers);
  }

  /**
   * Build a definition from a parsed JSON tree. An explicit name takes precedence over the "name"
   * field of the description.
   */
  public <T> MachineDefinition<T> load(final String name, final JsonNode description,
      final TransitionHandlers<T> handlers) throws StateMachineException {
    if (description == null || !description.isObject()) {
      throw new StateMachineException(Code.MALFORMED_DEFINITION,
          "Definition must be a JSON object");
    }
    final String definitionName = name != null ? name : readName(description);

    final TransitionTable transitionTable = readTransitions(definitionName, description);

    final JsonNode defaultState = description.get(DEFAULT_STATE);
    if (defaultState == null || !defaultState.isTextual()) {
      throw new StateMachineException(Code.MALFORMED_DEFINITION,
          String.format("'%s' must be a string in %s", DEFAULT_STATE, definitionName));
    }
    if (!transitionTable.isValidState(defaultState.asText())) {
      final String message = String.format("Default state '%s' is not a recognized state of %s",
          defaultState.asText(), definitionName);
      throw new StateMachineException(Code.MALFORMED_DEFINITION, message,
          new StateMachineException(Code.INVALID_DEFAULT_STATE, message));
    }

    final MachineDefinition<T> definition = MachineDefinitionBuilder.<T>newBuilder()
        .name(definitionName).transitions(transitionTable).defaultState(defaultState.asText())
        .handlers(handlers).build();
    logger.info(String.format("Loaded definition %s with states %s, default state %s",
        definition.getName(), transitionTable.allStates(), definition.getDefaultState()));
    return definition;
  }

  private static String readName(final JsonNode description) throws StateMachineException {
    final JsonNode name = description.get(NAME);
    if (name == null || name.isNull()) {
      return MachineDefinition.ANONYMOUS;
    }
    if (!name.isTextual()) {
      throw new StateMachineException(Code.MALFORMED_DEFINITION,
          String.format("'%s' must be a string", NAME));
    }
    return name.asText();
  }

  private static TransitionTable readTransitions(final String definitionName,
      final JsonNode description) throws StateMachineException {
    JsonNode transitions = description.get(TRANSITIONS);
    if (transitions == null) {
      transitions = description.get(ALLOWED_TRANSITIONS);
    }
    if (transitions == null || !transitions.isObject()) {
      throw new StateMachineException(Code.MALFORMED_DEFINITION,
          String.format("'%s' must be an object in %s", TRANSITIONS, definitionName));
    }

    final TransitionTableBuilder builder = TransitionTableBuilder.newBuilder();
    final Iterator<Map.Entry<String, JsonNode>> entries = transitions.fields();
    while (entries.hasNext()) {
      final Map.Entry<String, JsonNode> entry = entries.next();
      final JsonNode destinations = entry.getValue();
      if (destinations.isNull()) {
        builder.terminal(entry.getKey());
        continue;
      }
      if (!destinations.isArray()) {
        throw new StateMachineException(Code.MALFORMED_DEFINITION, String.format(
            "Transitions of '%s' must be a list or null in %s", entry.getKey(), definitionName));
      }
      final List<String> toStates = new ArrayList<>(destinations.size());
      for (final JsonNode destination : destinations) {
        if (!destination.isTextual()) {
          throw new StateMachineException(Code.MALFORMED_DEFINITION,
              String.format("Transitions of '%s' must only hold state names in %s",
                  entry.getKey(), definitionName));
        }
        toStates.add(destination.asText());
      }
      builder.transitions(entry.getKey(), toStates);
    }

    try {
      return builder.build();
    } catch (StateMachineException problem) {
      throw new StateMachineException(Code.MALFORMED_DEFINITION,
          String.format("Invalid transitions in %s: %s", definitionName, problem.getMessage()),
          problem);
    }
  }

}
