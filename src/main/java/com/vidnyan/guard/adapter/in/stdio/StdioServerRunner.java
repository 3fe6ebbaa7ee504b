package com.vidnyan.guard.adapter.in.stdio;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Serves the stdio protocol on the process streams when started with {@code --stdio}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "guard.transport", havingValue = "stdio")
public class StdioServerRunner implements CommandLineRunner {
    
    private final StdioTransport transport;
    
    @Override
    public void run(String... args) throws Exception {
        log.info("Architecture Guard listening on stdio");
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        Writer out = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
        transport.serve(in, out);
    }
}
