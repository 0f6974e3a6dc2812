package io.mnemo.cli;

import io.mnemo.core.MnemoRuntime;
import io.mnemo.core.consolidation.ConsolidationReport;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "consolidate", description = "Summarize sessions, merge, decay and archive memories")
public final class ConsolidateCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--watch", description = "Keep running and consolidate whenever a trigger fires")
    boolean watch;

    public ConsolidateCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (MnemoRuntime runtime = context.openRuntime()) {
            if (!watch) {
                print(runtime.consolidationScheduler().runNow());
                return 0;
            }
            CountDownLatch shutdown = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            runtime.consolidationScheduler().requestRun();
            runtime.startConsolidation();
            System.out.println("Consolidation running, press Ctrl+C to stop");
            shutdown.await();
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        } catch (Exception e) {
            System.err.println("Consolidate command failed: " + e.getMessage());
            return 1;
        }
    }

    static void print(ConsolidationReport report) {
        System.out.println("Sessions summarized: " + report.sessionsSummarized()
            + (report.summaryFailures() > 0 ? " (" + report.summaryFailures() + " deferred)" : ""));
        System.out.println("Memories merged: " + report.memoriesMerged());
        System.out.println("Memories decayed: " + report.memoriesDecayed());
        System.out.println("Turns archived: " + report.turnsArchived());
        if (report.skippedBusy() > 0) {
            System.out.println("Skipped (busy): " + report.skippedBusy());
        }
    }
}
