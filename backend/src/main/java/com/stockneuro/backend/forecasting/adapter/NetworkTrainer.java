package com.stockneuro.backend.forecasting.adapter;

import com.stockneuro.backend.exception.ArtifactStorageException;
import com.stockneuro.backend.exception.InsufficientDataException;
import com.stockneuro.backend.exception.ShapeMismatchException;
import com.stockneuro.backend.exception.TrainingCancelledException;
import com.stockneuro.backend.exception.TrainingDivergedException;
import com.stockneuro.backend.forecasting.data.Window;
import lombok.extern.slf4j.Slf4j;
import org.deeplearning4j.datasets.iterator.utilty.ListDataSetIterator;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.deeplearning4j.util.ModelSerializer;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.dataset.DataSet;
import org.nd4j.linalg.factory.Nd4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Shared DL4J plumbing for the network-backed adapters: tensor encoding, the guarded
 * epoch loop and artifact framing.
 */
@Component
@Slf4j
public class NetworkTrainer {

    private static final int ARTIFACT_FORMAT = 1;

    public void requireTrainable(List<Window> windows) {
        if (windows == null || windows.isEmpty()) {
            throw new InsufficientDataException("No training windows supplied");
        }
    }

    public INDArray recurrentFeatures(List<Window> windows) {
        int length = windows.get(0).length();
        double[][][] features = new double[windows.size()][1][length];
        for (int i = 0; i < windows.size(); i++) {
            features[i][0] = windows.get(i).values();
        }
        return Nd4j.create(features);
    }

    public INDArray labels(double[] targets) {
        double[][] labels = new double[targets.length][1];
        for (int i = 0; i < targets.length; i++) {
            labels[i][0] = targets[i];
        }
        return Nd4j.create(labels);
    }

    public void fit(MultiLayerNetwork network, INDArray features, INDArray labels,
                    HyperparameterSet hyperparameters, CancellationToken cancellationToken) {
        network.setListeners(new TrainingGuardListener(cancellationToken));
        ListDataSetIterator<DataSet> iterator =
                new ListDataSetIterator<>(new DataSet(features, labels).asList(), hyperparameters.batchSize());
        try {
            for (int epoch = 0; epoch < hyperparameters.epochs(); epoch++) {
                cancellationToken.throwIfCancelled();
                iterator.reset();
                network.fit(iterator);
                double score = network.score();
                if (!Double.isFinite(score)) {
                    throw new TrainingDivergedException("Loss became non-finite after epoch " + (epoch + 1));
                }
                log.debug("{} epoch {}/{} score={}", hyperparameters.architecture(), epoch + 1,
                        hyperparameters.epochs(), score);
            }
        } catch (RuntimeException ex) {
            throw unwrap(ex);
        } finally {
            network.setListeners();
        }
    }

    public double[] output(MultiLayerNetwork network, INDArray features) {
        INDArray output = network.output(features, false);
        long rows = output.size(0);
        double[] values = new double[(int) rows];
        for (int i = 0; i < rows; i++) {
            values[i] = output.getDouble(i, 0);
        }
        return values;
    }

    public void requireInputLength(ModelHandle handle, List<Window> windows) {
        for (Window window : windows) {
            if (window.length() != handle.inputLength()) {
                throw new ShapeMismatchException(handle.architecture() + " model expects windows of length "
                        + handle.inputLength() + " but got " + window.length());
            }
        }
    }

    public byte[] write(NetworkModelHandle handle) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeInt(ARTIFACT_FORMAT);
            out.writeUTF(handle.architecture().name());
            out.writeInt(handle.inputLength());
            out.writeInt(handle.effectiveLayers());
            PatchLayout layout = handle.patchLayout();
            out.writeInt(layout == null ? 0 : layout.patchLength());
            out.writeInt(layout == null ? 0 : layout.stride());
            out.writeInt(layout == null ? 0 : layout.patchCount());
            ModelSerializer.writeModel(handle.network(), out, false);
        } catch (IOException ex) {
            throw new ArtifactStorageException("Failed to serialize " + handle.architecture() + " network", ex);
        }
        return bytes.toByteArray();
    }

    public NetworkModelHandle read(byte[] artifact, Architecture expected) {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(artifact))) {
            int format = in.readInt();
            if (format != ARTIFACT_FORMAT) {
                throw new ArtifactStorageException("Unsupported artifact format " + format);
            }
            Architecture architecture = Architecture.valueOf(in.readUTF());
            if (architecture != expected) {
                throw new ArtifactStorageException("Artifact holds a " + architecture + " model, expected " + expected);
            }
            int inputLength = in.readInt();
            int layers = in.readInt();
            int patchLength = in.readInt();
            int stride = in.readInt();
            int patchCount = in.readInt();
            MultiLayerNetwork network = ModelSerializer.restoreMultiLayerNetwork(in, false);
            PatchLayout layout = patchLength > 0 ? new PatchLayout(patchLength, stride, patchCount) : null;
            return new NetworkModelHandle(architecture, network, inputLength, layers, layout);
        } catch (IOException ex) {
            throw new ArtifactStorageException("Failed to restore " + expected + " network", ex);
        }
    }

    public NetworkModelHandle requireNetworkHandle(ModelHandle handle, Architecture expected) {
        if (!(handle instanceof NetworkModelHandle networkHandle) || handle.architecture() != expected) {
            throw new IllegalArgumentException("Expected a " + expected + " network handle but got "
                    + (handle == null ? "null" : handle.architecture()));
        }
        return networkHandle;
    }

    private RuntimeException unwrap(RuntimeException ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof TrainingDivergedException || current instanceof TrainingCancelledException) {
                return (RuntimeException) current;
            }
            current = current.getCause();
        }
        return ex;
    }
}
