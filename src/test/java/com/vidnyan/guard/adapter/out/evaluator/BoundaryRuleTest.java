package com.vidnyan.guard.adapter.out.evaluator;

import com.vidnyan.guard.domain.model.RuleOptions;
import com.vidnyan.guard.domain.model.RuleResult;
import com.vidnyan.guard.domain.model.SourcePath;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BoundaryRuleTest {

    private static final String COUNTER = """
            import { useState } from 'react';

            export default function Counter() {
              const [count, setCount] = useState(0);
              return <button onClick={() => setCount(count + 1)}>{count}</button>;
            }
            """;

    private final BoundaryRule rule = new BoundaryRule();

    private RuleResult check(String path, String content) {
        return rule.check(SourcePath.of(path), content, RuleOptions.defaults());
    }

    @Test
    void check_ShouldFlagStateHookWithoutClientDirective() {
        RuleResult result = check("components/counter-client.tsx", COUNTER);

        assertFalse(result.errors().isEmpty());
        assertTrue(result.errors().get(0).contains("useState"));
    }

    @Test
    void check_ShouldAcceptTheSameContentWithLeadingDirective() {
        RuleResult result = check("components/counter-client.tsx", "'use client';\n\n" + COUNTER);

        assertTrue(result.errors().isEmpty());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void check_ShouldFlagDirectiveThatIsNotTheFirstStatement() {
        String content = "import { useState } from 'react';\n'use client';\n" + COUNTER.lines().skip(1)
                .reduce("", (a, b) -> a + b + "\n");

        RuleResult result = check("components/counter-client.tsx", content);

        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).contains("first statement"));
    }

    @Test
    void check_ShouldWarnWhenDirectiveHasNothingInteractive() {
        RuleResult result = check("components/label-client.tsx",
                "\"use client\";\nexport function Label() { return <span>Label</span>; }\n");

        assertTrue(result.errors().isEmpty());
        assertEquals(1, result.warnings().size());
    }

    @Test
    void check_ShouldAllowLeadingCommentsBeforeDirective() {
        RuleResult result = check("components/counter-client.tsx",
                "// Interactive counter\n/* v2 */\n'use client'\n" + COUNTER);

        assertTrue(result.errors().isEmpty());
    }

    @Test
    void check_ShouldFlagBrowserGlobalsInServerComponents() {
        RuleResult result = check("components/theme.tsx",
                "export default function Theme() { return <p>{window.innerWidth}</p>; }\n");

        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).contains("window"));
    }

    @Test
    void check_ShouldFlagServerOnlyImportInClientModule() {
        RuleResult result = check("components/secret-client.tsx",
                "'use client';\nimport 'server-only';\nimport { useState } from 'react';\n"
                        + "export function Secret() { const [s] = useState(''); return <p>{s}</p>; }\n");

        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).contains("server-only"));
    }

    @Test
    void check_ShouldReturnNothingForACleanServerComponent() {
        RuleResult result = check("app/page.tsx", """
                // useState( mentioned only in a comment
                export default function Page() {
                  return <main>Hello</main>;
                }
                """);

        assertTrue(result.isClean());
    }

    @Test
    void appliesTo_ShouldOnlyCoverComponentFiles() {
        assertTrue(rule.appliesTo(SourcePath.of("components/button.tsx")));
        assertTrue(rule.appliesTo(SourcePath.of("components/button.jsx")));
        assertFalse(rule.appliesTo(SourcePath.of("lib/utils.ts")));
    }
}
