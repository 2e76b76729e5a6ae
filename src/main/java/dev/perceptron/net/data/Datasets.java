package dev.perceptron.net.data;

import dev.perceptron.net.EvaluationExample;
import dev.perceptron.net.TrainingExample;
import dev.perceptron.net.math.Matrix;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversions between labelled inputs and the example types the trainer consumes.
 */
public final class Datasets {

    /**
     * One-hot column of length {@code classes} with a 1.0 at {@code label}.
     */
    public static Matrix vectorizedResult(int label, int classes) {
        if (label < 0 || label >= classes)
            throw new IllegalArgumentException("Label " + label + " outside [0, " + classes + ")");
        Matrix target = Matrix.zeros(classes, 1);
        target.set(label, 0, 1.0);
        return target;
    }

    public static TrainingExample trainingExample(Matrix input, int label, int classes) {
        return new TrainingExample(input, vectorizedResult(label, classes));
    }

    /**
     * Turn one-hot training examples into evaluation examples (label = argmax of the target).
     */
    public static List<EvaluationExample> toEvaluation(List<TrainingExample> examples) {
        List<EvaluationExample> result = new ArrayList<>(examples.size());
        for (TrainingExample example : examples)
            result.add(new EvaluationExample(example.input(), labelOf(example.target())));
        return result;
    }

    private static int labelOf(Matrix oneHot) {
        int label = 0;
        for (int i = 1; i < oneHot.size(); i++) {
            if (oneHot.at(i) > oneHot.at(label))
                label = i;
        }
        return label;
    }

    private Datasets() {}
}
