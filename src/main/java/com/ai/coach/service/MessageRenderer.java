package com.ai.coach.service;

import com.ai.coach.component.ContentResolver;
import com.ai.coach.conversation.ChatMessage;
import com.ai.coach.conversation.Choice;
import com.ai.coach.conversation.MessageType;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns a displayable node into the messages shown to the user: semantic content lookup,
 * placeholder substitution, then one message per bubble of multi-bubble text.
 * <p>
 * Animation and content key stay on the first bubble. An interactive node keeps its kind,
 * choices and input settings on the last bubble only; earlier bubbles become plain bot text.
 */
public class MessageRenderer {

    private final TextTemplatingService templatingService;
    private final ContentResolver contentResolver;
    private final String separator;

    public MessageRenderer(TextTemplatingService templatingService, ContentResolver contentResolver, String separator) {
        this.templatingService = templatingService;
        this.contentResolver = contentResolver;
        this.separator = separator;
    }

    public List<ChatMessage> render(ChatMessage node) {
        String text = node.getText();
        if (StringUtils.isNotBlank(node.getContentKey()) && contentResolver != null) {
            text = contentResolver.resolve(node.getContentKey()).orElse(text);
        }
        text = templatingService.process(text);

        ChatMessage resolved = node.toBuilder()
                .text(text)
                .choices(node.getChoices().isEmpty() ? null : renderChoices(node.getChoices()))
                .build();
        return expand(resolved);
    }

    private List<Choice> renderChoices(List<Choice> choices) {
        return choices.stream()
                .map(c -> c.toBuilder().text(templatingService.process(c.getText())).build())
                .collect(Collectors.toList());
    }

    List<ChatMessage> expand(ChatMessage message) {
        List<ChatMessage> out = new ArrayList<>();
        if (!message.hasMultipleTexts(separator)) {
            out.add(message);
            return out;
        }

        List<String> parts = new ArrayList<>();
        for (String part : StringUtils.splitByWholeSeparator(message.getText(), separator)) {
            if (StringUtils.isNotBlank(part)) {
                parts.add(part.trim());
            }
        }
        if (parts.isEmpty()) {
            out.add(message.toBuilder().text("").build());
            return out;
        }

        for (int i = 0; i < parts.size(); i++) {
            boolean first = i == 0;
            boolean last = i == parts.size() - 1;
            ChatMessage.ChatMessageBuilder bubble = message.toBuilder().text(parts.get(i));
            if (!first) {
                bubble.animation(null).contentKey(null);
            }
            if (!last && message.isInteractive()) {
                bubble.type(MessageType.BOT).choices(null).storeKey(null).placeholderText(null);
            }
            out.add(bubble.build());
        }
        return out;
    }
}
