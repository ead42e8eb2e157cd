package com.pivotcalc.client;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import com.pivotcalc.backend.aggregator.AggregatorRegistry;
import com.pivotcalc.backend.server.PivotExecutor;
import com.pivotcalc.backend.utils.PivotNumeric;
import com.pivotcalc.common.PivotDefinition;
import com.pivotcalc.common.PivotDefinitionCodec;

/**
 * 用法：Launcher &lt;definition.json&gt; [locale]
 */
public class Launcher {
    public static void main(String[] args) throws IOException {
        if (args.length < 1) {
            System.err.println("Usage: Launcher <definition.json> [locale]");
            System.exit(1);
        }
        PivotDefinition definition = PivotDefinitionCodec.decode(Files.readAllBytes(Path.of(args[0])));
        Locale locale = args.length > 1 ? Locale.forLanguageTag(args[1]) : Locale.getDefault();
        PivotExecutor executor = PivotExecutor.of(definition, new AggregatorRegistry(new PivotNumeric(locale)), "shell");
        new Shell(executor).run();
    }
}
