package com.rosarchitect.core.assembler;

import com.rosarchitect.core.model.Direction;
import com.rosarchitect.core.model.InterfaceDeclaration;
import com.rosarchitect.core.model.InterfaceKind;
import com.rosarchitect.core.util.RosNames;

import java.util.List;

/**
 * The five topics of an actionlib action.
 *
 * <p>A server subscribes to {@code goal} and {@code cancel} and publishes {@code status},
 * {@code feedback} and {@code result}; a client does the opposite. Goal, feedback and
 * result types are the action type with a {@code Goal}, {@code Feedback} or
 * {@code Result} suffix.
 */
final class ActionTopics {

    static final String GOAL_ID_TYPE = "actionlib_msgs/GoalID";
    static final String STATUS_TYPE = "actionlib_msgs/GoalStatusArray";

    private ActionTopics() {
        // Utility class
    }

    /**
     * Expands an action declaration into topic declarations.
     *
     * @param action resolved, remapped action name
     * @param declaration action declaration; {@link Direction#PROVIDE} for servers,
     *                    {@link Direction#CALL} for clients
     * @return five topic declarations with absolute names
     */
    static List<InterfaceDeclaration> expand(String action, InterfaceDeclaration declaration) {
        boolean server = declaration.direction() == Direction.PROVIDE;
        Direction inbound = server ? Direction.SUBSCRIBE : Direction.PUBLISH;
        Direction outbound = server ? Direction.PUBLISH : Direction.SUBSCRIBE;
        boolean known = declaration.hasKnownType();
        String type = declaration.type();

        return List.of(
            topic(action, "goal", inbound, known ? type + "Goal" : null),
            topic(action, "cancel", inbound, GOAL_ID_TYPE),
            topic(action, "status", outbound, STATUS_TYPE),
            topic(action, "feedback", outbound, known ? type + "Feedback" : null),
            topic(action, "result", outbound, known ? type + "Result" : null)
        );
    }

    private static InterfaceDeclaration topic(String action, String suffix, Direction direction, String type) {
        return InterfaceDeclaration.of(InterfaceKind.TOPIC, direction, RosNames.join(action, suffix), type);
    }
}
