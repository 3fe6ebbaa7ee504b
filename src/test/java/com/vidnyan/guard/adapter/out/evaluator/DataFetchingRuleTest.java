package com.vidnyan.guard.adapter.out.evaluator;

import com.vidnyan.guard.domain.model.RuleOptions;
import com.vidnyan.guard.domain.model.RuleResult;
import com.vidnyan.guard.domain.model.SourcePath;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DataFetchingRuleTest {

    private final DataFetchingRule rule = new DataFetchingRule();

    private RuleResult check(String path, String content) {
        return rule.check(SourcePath.of(path), content, RuleOptions.defaults());
    }

    @Test
    void check_ShouldWarnAboutUncachedServerFetch() {
        RuleResult result = check("app/posts/page.tsx", """
                export default async function Page() {
                  const res = await fetch('https://api.example.com/posts');
                  const posts = await res.json();
                  return <ul>{posts.length}</ul>;
                }
                """);

        assertTrue(result.errors().isEmpty());
        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).contains("caching"));
    }

    @Test
    void check_ShouldAcceptServerFetchWithRevalidate() {
        RuleResult result = check("app/posts/page.tsx", """
                export default async function Page() {
                  const res = await fetch('https://api.example.com/posts', { next: { revalidate: 60 } });
                  return <ul>{(await res.json()).length}</ul>;
                }
                """);

        assertTrue(result.isClean());
    }

    @Test
    void check_ShouldFlagFetchOutsideAsyncCode() {
        RuleResult result = check("lib/load-posts.ts",
                "export function loadPosts() { return fetch('/api/posts', { cache: 'no-store' }); }\n");

        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).contains("async"));
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void check_ShouldWarnAboutSequentialFetches() {
        RuleResult result = check("app/dashboard/page.tsx", """
                export const revalidate = 60;
                export default async function Page() {
                  const user = await fetch('/api/user');
                  const stats = await fetch('/api/stats');
                  return <div />;
                }
                """);

        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).contains("Promise.all"));
    }

    @Test
    void check_ShouldFlagLegacyDataFunctionsInAppRouter() {
        RuleResult result = check("app/legacy/page.tsx",
                "export async function getServerSideProps() { return { props: {} }; }\n"
                        + "export default function Page() { return null; }\n");

        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).startsWith("getServerSideProps"));
    }

    @Test
    void check_ShouldFlagClientFetchDuringRender() {
        RuleResult result = check("components/list-client.tsx", """
                'use client';
                export function List() {
                  fetch('/api/items');
                  return null;
                }
                """);

        assertEquals(1, result.errors().size());
    }

    @Test
    void check_ShouldWarnAboutClientFetchInsideUseEffect() {
        RuleResult result = check("components/list-client.tsx", """
                'use client';
                import { useEffect } from 'react';
                export function List() {
                  useEffect(() => { fetch('/api/items'); }, []);
                  return null;
                }
                """);

        assertTrue(result.errors().isEmpty());
        assertEquals(1, result.warnings().size());
    }

    @Test
    void check_ShouldAcceptClientFetchThroughSwr() {
        RuleResult result = check("components/list-client.tsx", """
                'use client';
                import useSWR from 'swr';
                const fetcher = (url: string) => fetch(url).then(r => r.json());
                export function List() {
                  const { data } = useSWR('/api/items', fetcher);
                  return <ul>{data?.length}</ul>;
                }
                """);

        assertTrue(result.isClean());
    }

    @Test
    void check_ShouldFlagRawSupabaseClientInClientModule() {
        RuleResult result = check("components/auth-client.tsx", """
                'use client';
                import { createClient } from '@supabase/supabase-js';
                const supabase = createClient(url, key);
                export function Auth() { return null; }
                """);

        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).contains("createClientComponentClient"));
    }
}
