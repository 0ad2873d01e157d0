package smartaqms.analytics.classifier;

public record LabeledSample(double[] features, int label) {
}
