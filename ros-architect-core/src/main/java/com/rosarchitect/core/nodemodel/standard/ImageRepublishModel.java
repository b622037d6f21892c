package com.rosarchitect.core.nodemodel.standard;

import com.rosarchitect.core.nodemodel.ModelContext;
import com.rosarchitect.core.nodemodel.ModelEvaluationException;
import com.rosarchitect.core.nodemodel.NodeModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Model of {@code image_transport/republish}.
 *
 * <p>Arguments are {@code IN_TRANSPORT [OUT_TRANSPORT]}. The node subscribes to {@code in}
 * over the input transport and publishes {@code out} over the output transport, or over
 * every known transport when none is given. {@code in:=} and {@code out:=} arguments are
 * remaps and are applied when the architecture is assembled.
 */
public class ImageRepublishModel implements NodeModel {

    private static final Map<String, Transport> TRANSPORTS = Map.of(
        "raw", new Transport("", "sensor_msgs/Image"),
        "compressed", new Transport("/compressed", "sensor_msgs/CompressedImage"),
        "theora", new Transport("/theora", "theora_image_transport/Packet")
    );
    private static final List<String> TRANSPORT_ORDER = List.of("raw", "compressed", "theora");

    @Override
    public String getPackageName() {
        return "image_transport";
    }

    @Override
    public String getExecutable() {
        return "republish";
    }

    @Override
    public String getDescription() {
        return "image_transport/republish (raw, compressed, theora)";
    }

    @Override
    public void declare(ModelContext context) {
        List<String> transports = new ArrayList<>();
        for (String word : context.args().trim().split("\\s+")) {
            if (!word.isEmpty() && !word.contains(":=")) {
                transports.add(word);
            }
        }

        String input = transports.isEmpty() ? "raw" : transports.get(0);
        context.subscribe("in" + transport(input).suffix(), transport(input).type());

        if (transports.size() > 1) {
            Transport output = transport(transports.get(1));
            context.publish("out" + output.suffix(), output.type());
        } else {
            for (String name : TRANSPORT_ORDER) {
                Transport output = TRANSPORTS.get(name);
                context.publish("out" + output.suffix(), output.type());
            }
        }
    }

    private static Transport transport(String name) {
        Transport transport = TRANSPORTS.get(name);
        if (transport == null) {
            throw new ModelEvaluationException("Unsupported image transport '" + name + "'");
        }
        return transport;
    }

    private record Transport(String suffix, String type) {
    }
}
