package io.sequences.demo;

public record DemoConfig(
        long seed,
        int bound,
        String separator
) {
    public static DemoConfig fromEnv() {
        long seed = Long.parseLong(System.getProperty("sequences.seed", System.getenv().getOrDefault("SEQUENCES_SEED", String.valueOf(System.nanoTime()))));
        int bound = Integer.parseInt(System.getProperty("sequences.bound", System.getenv().getOrDefault("SEQUENCES_BOUND", "100")));
        String separator = System.getProperty("sequences.separator", System.getenv().getOrDefault("SEQUENCES_SEPARATOR", "; "));
        return new DemoConfig(seed, bound, separator);
    }

    public DemoConfig withSeed(long seed) { return new DemoConfig(seed, bound, separator); }
    public DemoConfig withBound(int bound) { return new DemoConfig(seed, bound, separator); }
    public DemoConfig withSeparator(String separator) { return new DemoConfig(seed, bound, separator); }
}
