package io.github.yok.schemaarchitect.core;

import io.github.yok.schemaarchitect.ddl.DdlDependencyResolver;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Rewrites the fenced {@code sql} code blocks of a free-text (Markdown) response so that DDL they
 * contain is ordered by foreign key dependency.
 *
 * <p>
 * Recognized fences are {@code ```sql}, {@code ```json} and {@code ```markdown}, each followed
 * by a line break and closed by the next {@code ```}. The trimmed content of every {@code sql}
 * block is passed through {@link DdlDependencyResolver#resolve(String)}; DML-only blocks
 * therefore come back unchanged. Everything outside {@code sql} blocks is left as is.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SqlCodeBlockFormatter {

    static final Pattern CODE_BLOCK =
            Pattern.compile("```(sql|json|markdown)\\r?\\n(.*?)```", Pattern.DOTALL);

    private final DdlDependencyResolver resolver;

    /**
     * Formats the given response.
     *
     * @param response response text; {@code null} is returned as is
     * @return the response with every non-empty {@code sql} block reordered
     */
    public String format(String response) {
        if (response == null) {
            return null;
        }

        Matcher matcher = CODE_BLOCK.matcher(response);
        StringBuilder out = new StringBuilder();
        int sqlBlocks = 0;
        while (matcher.find()) {
            String language = matcher.group(1);
            String content = matcher.group(2).trim();
            String replacement = matcher.group();
            if ("sql".equals(language) && !content.isEmpty()) {
                replacement = "```sql\n" + resolver.resolve(content) + "\n```";
                sqlBlocks++;
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);

        log.info("Formatted response: {} sql block(s) processed", sqlBlocks);
        return out.toString();
    }
}
