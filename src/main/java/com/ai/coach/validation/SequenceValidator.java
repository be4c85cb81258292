package com.ai.coach.validation;

import com.ai.coach.conversation.ChatMessage;
import com.ai.coach.conversation.ChatSequence;
import com.ai.coach.conversation.Choice;
import com.ai.coach.conversation.DataAction;
import com.ai.coach.conversation.MessageType;
import com.ai.coach.conversation.RouteCondition;
import com.ai.coach.service.ConditionEvaluator;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks run on every loaded sequence. Errors make the document unusable;
 * warnings flag graphs that load but will probably not behave as the author intended.
 */
@Component
public class SequenceValidator {

    public ValidationResult validate(ChatSequence sequence) {
        List<ValidationIssue> issues = new ArrayList<>();
        if (StringUtils.isBlank(sequence.getSequenceId())) {
            issues.add(ValidationIssue.error(null, "sequenceId is blank"));
        }
        if (sequence.isEmpty()) {
            issues.add(ValidationIssue.warning(null, "sequence has no messages"));
        }

        Set<Integer> seen = new HashSet<>();
        for (ChatMessage message : sequence.getMessages()) {
            if (!seen.add(message.getId())) {
                issues.add(ValidationIssue.error(message.getId(), "duplicate message id"));
            }
        }

        for (ChatMessage message : sequence.getMessages()) {
            checkStructure(message, issues);
            checkReferences(sequence, message, issues);
        }
        return new ValidationResult(sequence.getSequenceId(), issues);
    }

    private static void checkStructure(ChatMessage message, List<ValidationIssue> issues) {
        int id = message.getId();
        MessageType type = message.getType();

        if (type == MessageType.AUTOROUTE) {
            if (message.getRoutes().isEmpty()) {
                issues.add(ValidationIssue.error(id, "autoroute without routes"));
            } else {
                checkRoutes(message, issues);
            }
        }
        if (type == MessageType.CHOICE && message.getChoices().isEmpty()) {
            issues.add(ValidationIssue.error(id, "choice without choices"));
        }
        if (type == MessageType.DATA_ACTION && message.getDataActions().isEmpty()) {
            issues.add(ValidationIssue.error(id, "dataAction without actions"));
        }
        for (DataAction action : message.getDataActions()) {
            if (action.getType() == null) {
                issues.add(ValidationIssue.warning(id, "data action of unknown type will be skipped: " + action));
            }
        }
        if (type != MessageType.CHOICE && !message.getChoices().isEmpty()) {
            issues.add(ValidationIssue.error(id, "choices on a " + type.getJsonName() + " message"));
        }
    }

    private static void checkRoutes(ChatMessage message, List<ValidationIssue> issues) {
        int id = message.getId();
        boolean hasDefault = false;
        for (RouteCondition route : message.getRoutes()) {
            if (!route.hasDestination()) {
                issues.add(ValidationIssue.error(id, "route without nextMessageId or sequenceId"));
            }
            if (route.isDefaultRoute()) {
                hasDefault = true;
                continue;
            }
            String condition = route.getCondition();
            if (StringUtils.isBlank(condition)) {
                issues.add(ValidationIssue.warning(id, "non-default route without condition never matches"));
            } else if (hasUnbalancedQuotes(condition)) {
                issues.add(ValidationIssue.warning(id, "unbalanced quotes in condition: " + condition));
            } else if (!containsOperator(condition)) {
                issues.add(ValidationIssue.warning(id, "condition has no comparison operator, it is a truthiness check: " + condition));
            }
        }
        if (!hasDefault) {
            issues.add(ValidationIssue.warning(id, "autoroute without default route"));
        }
    }

    private static void checkReferences(ChatSequence sequence, ChatMessage message, List<ValidationIssue> issues) {
        int id = message.getId();
        if (message.getNextMessageId() != null && !sequence.hasMessage(message.getNextMessageId())) {
            issues.add(ValidationIssue.warning(id, "nextMessageId " + message.getNextMessageId() + " does not exist"));
        }
        for (RouteCondition route : message.getRoutes()) {
            if (route.getSequenceId() == null && route.getNextMessageId() != null
                    && !sequence.hasMessage(route.getNextMessageId())) {
                issues.add(ValidationIssue.warning(id, "route target " + route.getNextMessageId() + " does not exist"));
            }
        }
        for (Choice choice : message.getChoices()) {
            if (choice.getSequenceId() == null && choice.getNextMessageId() != null
                    && !sequence.hasMessage(choice.getNextMessageId())) {
                issues.add(ValidationIssue.warning(id, "choice target " + choice.getNextMessageId() + " does not exist"));
            }
        }
    }

    private static boolean containsOperator(String condition) {
        for (String part : condition.split("\\|\\||&&")) {
            if (!ConditionEvaluator.hasOperator(part)) {
                return false;
            }
        }
        return true;
    }

    static boolean hasUnbalancedQuotes(String condition) {
        boolean inSingle = false;
        boolean inDouble = false;
        for (char ch : condition.toCharArray()) {
            if (ch == '\'' && !inDouble) {
                inSingle = !inSingle;
            } else if (ch == '"' && !inSingle) {
                inDouble = !inDouble;
            }
        }
        return inSingle || inDouble;
    }
}
