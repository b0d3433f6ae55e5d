package com.thriftgen.testdata.fixtures.testdata;

import java.util.List;

import com.thriftgen.testdata.Binding;
import com.thriftgen.testdata.Gen;
import com.thriftgen.testdata.GenContext;
import com.thriftgen.testdata.Gens;
import com.thriftgen.testdata.TestData;
import com.thriftgen.testdata.fixtures.Point;

/**
 * Test data for {@link com.thriftgen.testdata.fixtures.Point}.
 */
public final class PointTestData {

    private PointTestData() {
        // Utility class
    }

    public static Gen<Point> getGenerator(GenContext context) {
        return Gen.letAll(
                List.of(
                        Binding.of("x", Gens.ints()),
                        Binding.of("y", Gen.nullable(Gens.ints()))),
                values -> Point.builder()
                        .x(values.get("x"))
                        .y(values.get("y"))
                        .build());
    }

    public static Point applyDefaults(Point struct_, GenContext context) {
        if (struct_ == null) {
            return null;
        }
        return struct_.toBuilder()
                .x(TestData.applyDefaults(struct_.getX(), context))
                .y(TestData.orDefault(TestData.applyDefaults(struct_.getY(), context), 5))
                .build();
    }
}
