package agentic.cli;

public final class Main {
    public static void main(String[] args) {
        BuildOptions options;
        try {
            options = BuildOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Usage: agentic build <files...> [--out <dir>] [--settings <path>]");
            System.exit(2);
            return;
        }

        System.out.println("[1/2] Compiling " + options.inputs().size() + " file(s) into " + options.outRoot());
        BuildDriver.Report report = new BuildDriver(options).run();

        System.out.println("[2/2] Done");
        for (BuildDriver.UnitResult unit : report.units()) {
            if (unit.ok()) {
                System.out.println("  ✓ " + unit.input() + " -> " + unit.output());
            } else {
                System.out.println("  ✗ " + unit.input() + ": " + unit.error());
            }
        }

        if (!report.ok()) {
            System.out.println("\n" + report.failures() + " of " + report.units().size() + " unit(s) failed");
            System.exit(1);
        }
        System.out.println("\n✓ Success: " + report.units().size() + " unit(s) built");
    }
}
