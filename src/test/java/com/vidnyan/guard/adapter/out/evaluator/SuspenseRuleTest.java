package com.vidnyan.guard.adapter.out.evaluator;

import com.vidnyan.guard.domain.model.RuleOptions;
import com.vidnyan.guard.domain.model.RuleResult;
import com.vidnyan.guard.domain.model.SourcePath;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SuspenseRuleTest {

    private final SuspenseRule rule = new SuspenseRule();

    private RuleResult check(String path, String content) {
        return rule.check(SourcePath.of(path), content, RuleOptions.defaults());
    }

    @Test
    void check_ShouldAcceptBoundaryWithFallbackAndErrorBoundary() {
        RuleResult result = check("components/feed.tsx", """
                import { Suspense } from 'react';
                import { ErrorBoundary } from 'react-error-boundary';
                export default function Feed() {
                  return (
                    <ErrorBoundary fallback={<p>Failed</p>}>
                      <Suspense fallback={<Spinner />}>
                        <Posts />
                      </Suspense>
                    </ErrorBoundary>
                  );
                }
                """);

        assertTrue(result.isClean());
    }

    @Test
    void check_ShouldFlagBoundaryWithoutFallback() {
        RuleResult result = check("components/feed.tsx", """
                import { ErrorBoundary } from 'react-error-boundary';
                export default function Feed() {
                  return <ErrorBoundary fallback={<p />}><Suspense><Posts /></Suspense></ErrorBoundary>;
                }
                """);

        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).contains("no fallback"));
    }

    @Test
    void check_ShouldWarnAboutEmptyFallbackAndMissingErrorBoundary() {
        RuleResult result = check("components/feed.tsx", """
                export default function Feed() {
                  return <Suspense fallback={null}><Posts /></Suspense>;
                }
                """);

        assertTrue(result.errors().isEmpty());
        assertEquals(2, result.warnings().size());
        assertTrue(result.warnings().get(0).contains("empty fallback"));
        assertTrue(result.warnings().get(1).contains("ErrorBoundary"));
    }

    @Test
    void check_ShouldWarnAboutStreamingPageWithoutSuspense() {
        RuleResult result = check("app/reports/page.tsx", """
                export default async function Page() {
                  const res = await fetch('https://api.example.com/reports');
                  return <div>{(await res.json()).length}</div>;
                }
                """);

        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).contains("<Suspense>"));
    }
}
