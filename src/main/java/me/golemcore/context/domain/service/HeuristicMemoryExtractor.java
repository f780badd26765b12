package me.golemcore.context.domain.service;

import me.golemcore.context.domain.model.Message;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword and pattern based extraction of topics and decisions, used when the
 * summarizer reply carries none.
 */
@Component
public class HeuristicMemoryExtractor {

    static final int MAX_TOPICS = 5;
    static final int MAX_DECISIONS = 5;
    static final int MAX_DECISION_LENGTH = 150;

    private static final List<String> TOPIC_KEYWORDS = List.of(
            "Java", "Spring", "TypeScript", "React", "Node.js", "Python", "API", "Database", "SQL",
            "Docker", "Kubernetes", "AI", "LLM", "RAG", "Embedding", "Context", "Memory", "Cache",
            "Bug", "Fix", "Error", "Performance", "Security", "Architecture", "Design", "Test",
            "Storage", "Search", "File", "Config");

    private static final List<Pattern> DECISION_PATTERNS = List.of(
            Pattern.compile("(?:we decided|decided to|decision was|chose to|will use|using)\\s+([^.]+)",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:solution|approach)[:\\s]+([^.]+)", Pattern.CASE_INSENSITIVE));

    public List<String> extractTopics(List<Message> messages) {
        Set<String> topics = new LinkedHashSet<>();
        for (Message message : messages) {
            String content = lower(message.getEffectiveContent());
            for (String keyword : TOPIC_KEYWORDS) {
                if (topics.size() >= MAX_TOPICS) {
                    return new ArrayList<>(topics);
                }
                if (content.contains(keyword.toLowerCase(Locale.ROOT))) {
                    topics.add(keyword);
                }
            }
        }
        if (topics.isEmpty()) {
            // opening words of user turns
            for (Message message : messages) {
                if (!message.isUserMessage() || topics.size() >= MAX_TOPICS) {
                    continue;
                }
                String[] words = lower(message.getContent()).trim().split("\\s+");
                if (words.length > 3) {
                    topics.add(String.join(" ", words[0], words[1], words[2]));
                }
            }
        }
        return new ArrayList<>(topics);
    }

    public List<String> extractDecisions(List<Message> messages) {
        Set<String> decisions = new LinkedHashSet<>();
        for (Message message : messages) {
            if (!message.isAssistantMessage() || message.getContent() == null) {
                continue;
            }
            for (Pattern pattern : DECISION_PATTERNS) {
                Matcher matcher = pattern.matcher(message.getContent());
                while (matcher.find() && decisions.size() < MAX_DECISIONS) {
                    String decision = matcher.group(1).trim();
                    if (!decision.isEmpty()) {
                        decisions.add(decision.length() > MAX_DECISION_LENGTH
                                ? decision.substring(0, MAX_DECISION_LENGTH)
                                : decision);
                    }
                }
            }
        }
        return new ArrayList<>(decisions);
    }

    private String lower(String content) {
        return content != null ? content.toLowerCase(Locale.ROOT) : "";
    }
}
