package com.vidnyan.guard.adapter.out.evaluator;

import com.vidnyan.guard.domain.model.RuleOptions;
import com.vidnyan.guard.domain.model.RuleResult;
import com.vidnyan.guard.domain.model.SourcePath;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StructureRuleTest {

    private final StructureRule rule = new StructureRule();

    private RuleResult check(String path, String content) {
        return rule.check(SourcePath.of(path), content, RuleOptions.defaults());
    }

    @Test
    void check_ShouldAcceptAWellFormedComponent() {
        RuleResult result = check("components/ui/button-client.tsx", """
                'use client';
                import { useState } from 'react';
                export default function Button() {
                  const [pressed, setPressed] = useState(false);
                  return <button onClick={() => setPressed(!pressed)}>Press</button>;
                }
                """);

        assertTrue(result.isClean());
    }

    @Test
    void check_ShouldWarnAboutNonKebabFileNames() {
        RuleResult result = check("components/UserCard.tsx",
                "export default function UserCard() { return null; }\n");

        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).contains("kebab-case"));
    }

    @Test
    void check_ShouldRequireDefaultExportForRouteModules() {
        RuleResult result = check("app/about/page.tsx",
                "export function About() { return <main>About</main>; }\n");

        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).contains("default export"));
    }

    @Test
    void check_ShouldRequirePascalCaseDefaultExport() {
        RuleResult result = check("components/user-card.tsx",
                "export default function userCard() { return null; }\n");

        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).contains("'userCard'"));
    }

    @Test
    void check_ShouldWarnAboutAnonymousDefaultExport() {
        RuleResult result = check("components/banner.tsx", "export default () => <div>Sale</div>;\n");

        assertTrue(result.errors().isEmpty());
        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).contains("Anonymous"));
    }

    @Test
    void check_ShouldWarnAboutFilesWithoutExports() {
        RuleResult result = check("components/orphan.tsx", "const Orphan = () => <div />;\n");

        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).contains("no exports"));
    }

    @Test
    void check_ShouldWarnAboutJsxFiles() {
        RuleResult result = check("components/legacy.jsx", "export default function Legacy() { return null; }\n");

        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).contains(".tsx"));
    }

    @Test
    void check_ShouldFlagClientComponentUnderServerDirectory() {
        RuleResult result = check("lib/server/widget.tsx", """
                'use client';
                export default function Widget() { return <div />; }
                """);

        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).contains("server/"));
    }

    @Test
    void check_ShouldFlagServerOnlyModuleInClientLocation() {
        RuleResult result = check("components/client/report.tsx", """
                import 'server-only';
                export default async function Report() { return <div />; }
                """);

        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).contains("Server-only"));
    }

    @Test
    void check_ShouldWarnAboutMisplacedClientComponent() {
        RuleResult result = check("components/toggle.tsx", """
                'use client';
                export default function Toggle() { return <input type="checkbox" />; }
                """);

        assertTrue(result.errors().isEmpty());
        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).contains("-client"));
    }
}
