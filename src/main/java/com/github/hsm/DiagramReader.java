package com.github.hsm;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.hsm.MachineSpec.MachineSpecBuilder;
import com.github.hsm.StateMachineException.Code;
import com.github.hsm.StateSpec.StateSpecBuilder;

/**
 * Reads a diagram saved by the editor into a {@link MachineSpec}. Only the simulation-relevant keys
 * are read; geometry, colors, comments and anything else the editor stores are ignored.
 *
 * <pre>
 * { "states": [ { "name", "is_initial", "is_final", "entry_action", "during_action",
 *                 "exit_action", "is_superstate", "sub_fsm_data": { "states", "transitions" } } ],
 *   "transitions": [ { "source", "target", "event", "condition", "action" } ] }
 * </pre>
 *
 * The reader opens nothing itself, callers hand it the text or an already open stream.
 */
public final class DiagramReader {
  private static final Logger logger = LogManager.getLogger(DiagramReader.class.getSimpleName());
  private static final ObjectMapper mapper = new ObjectMapper();

  public static MachineSpec fromString(final String json) throws StateMachineException {
    if (json == null) {
      throw new StateMachineException(Code.INVALID_DIAGRAM, "Diagram text cannot be null");
    }
    try {
      return toMachineSpec(mapper.readTree(json), "diagram");
    } catch (IOException problem) {
      throw new StateMachineException(Code.INVALID_DIAGRAM,
          "Failed to parse diagram: " + problem.getMessage(), problem);
    }
  }

  public static MachineSpec fromReader(final Reader reader) throws StateMachineException {
    try {
      return toMachineSpec(mapper.readTree(reader), "diagram");
    } catch (IOException problem) {
      throw new StateMachineException(Code.INVALID_DIAGRAM,
          "Failed to read diagram: " + problem.getMessage(), problem);
    }
  }

  public static MachineSpec fromStream(final InputStream stream) throws StateMachineException {
    try {
      return toMachineSpec(mapper.readTree(stream), "diagram");
    } catch (IOException problem) {
      throw new StateMachineException(Code.INVALID_DIAGRAM,
          "Failed to read diagram: " + problem.getMessage(), problem);
    }
  }

  private static MachineSpec toMachineSpec(final JsonNode node, final String where)
      throws StateMachineException {
    if (node == null || node.isMissingNode() || !node.isObject()) {
      throw new StateMachineException(Code.INVALID_DIAGRAM, where + " must be a JSON object");
    }
    final MachineSpecBuilder builder = MachineSpecBuilder.newBuilder();
    for (final JsonNode stateNode : array(node, "states", where)) {
      builder.state(toStateSpec(stateNode, where));
    }
    for (final JsonNode transitionNode : array(node, "transitions", where)) {
      builder.transition(toTransitionSpec(transitionNode, where));
    }
    final MachineSpec spec = builder.build();
    if (logger.isDebugEnabled()) {
      logger.debug("Read " + where + " with " + spec.getStates().size() + " state(s) and "
          + spec.getTransitions().size() + " transition(s)");
    }
    return spec;
  }

  private static StateSpec toStateSpec(final JsonNode node, final String where)
      throws StateMachineException {
    if (!node.isObject()) {
      throw new StateMachineException(Code.INVALID_DIAGRAM,
          "Every state of the " + where + " must be a JSON object");
    }
    final String name = text(node, "name");
    if (name == null || name.trim().isEmpty()) {
      throw new StateMachineException(Code.INVALID_DIAGRAM,
          "A state of the " + where + " has no name");
    }
    final StateSpecBuilder builder = StateSpecBuilder.newBuilder(name)
        .initial(node.path("is_initial").asBoolean(false))
        .finalState(node.path("is_final").asBoolean(false))
        .entryAction(text(node, "entry_action")).duringAction(text(node, "during_action"))
        .exitAction(text(node, "exit_action"));
    if (node.path("is_superstate").asBoolean(false)) {
      final JsonNode subNode = node.get("sub_fsm_data");
      if (subNode == null || subNode.isNull()) {
        builder.superstate(true);
      } else {
        builder.subMachine(toMachineSpec(subNode, "sub-machine of '" + name.trim() + "'"));
      }
    }
    return builder.build();
  }

  private static TransitionSpec toTransitionSpec(final JsonNode node, final String where)
      throws StateMachineException {
    if (!node.isObject()) {
      throw new StateMachineException(Code.INVALID_DIAGRAM,
          "Every transition of the " + where + " must be a JSON object");
    }
    final String source = text(node, "source");
    final String target = text(node, "target");
    if (source == null || target == null) {
      throw new StateMachineException(Code.INVALID_DIAGRAM,
          "A transition of the " + where + " is missing its source or target");
    }
    return new TransitionSpec(source, target, text(node, "event"), text(node, "condition"),
        text(node, "action"));
  }

  private static Iterable<JsonNode> array(final JsonNode node, final String field,
      final String where) throws StateMachineException {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return mapper.createArrayNode();
    }
    if (!value.isArray()) {
      throw new StateMachineException(Code.INVALID_DIAGRAM,
          "'" + field + "' of the " + where + " must be a JSON array");
    }
    return value;
  }

  private static String text(final JsonNode node, final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    return value.isValueNode() ? value.asText() : value.toString();
  }

  private DiagramReader() {}
}
