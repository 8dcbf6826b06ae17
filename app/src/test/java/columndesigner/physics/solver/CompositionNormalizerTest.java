package columndesigner.physics.solver;

import columndesigner.domain.exception.InvalidCompositionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class CompositionNormalizerTest {

    @Test
    @DisplayName("La composición normalizada suma 1 y conserva las proporciones")
    void normalize_rescalesToUnitSum() {
        double[] raw = {1.0, 2.0, 5.0, 2.0};

        double[] z = CompositionNormalizer.normalize(raw);

        assertEquals(1.0, Arrays.stream(z).sum(), 1e-12);
        assertArrayEquals(new double[]{0.1, 0.2, 0.5, 0.2}, z, 1e-12);
        assertArrayEquals(new double[]{1.0, 2.0, 5.0, 2.0}, raw, "La entrada no debe modificarse");
    }

    @Test
    @DisplayName("Un componente con fracción cero se mantiene en cero")
    void normalize_keepsZeroEntries() {
        double[] z = CompositionNormalizer.normalize(new double[]{0.0, 3.0, 1.0});
        assertEquals(0.0, z[0]);
        assertEquals(0.75, z[1], 1e-12);
    }

    @Test
    @DisplayName("Fracciones enormes cuya suma desbordaría se normalizan igualmente")
    void normalize_handlesHugeEntries() {
        double[] z = CompositionNormalizer.normalize(new double[]{1e308, 1e308, 0.0});

        assertArrayEquals(new double[]{0.5, 0.5, 0.0}, z, 1e-12);
        assertEquals(1.0, Arrays.stream(z).sum(), 1e-9);
    }

    @Test
    @DisplayName("Fracciones diminutas también suman 1 tras normalizar")
    void normalize_handlesTinyEntries() {
        double[] z = CompositionNormalizer.normalize(new double[]{1e-320, 3e-320});

        assertEquals(1.0, Arrays.stream(z).sum(), 1e-9);
        assertEquals(0.25, z[0], 1e-3);
    }

    @Test
    @DisplayName("Entradas negativas, no finitas o de suma nula se rechazan")
    void normalize_rejectsInvalidInput() {
        assertThrows(InvalidCompositionException.class, () -> CompositionNormalizer.normalize(new double[]{0.5, -0.1}));
        assertThrows(InvalidCompositionException.class, () -> CompositionNormalizer.normalize(new double[]{0.5, Double.NaN}));
        assertThrows(InvalidCompositionException.class,
                () -> CompositionNormalizer.normalize(new double[]{0.5, Double.POSITIVE_INFINITY}));
        assertThrows(InvalidCompositionException.class, () -> CompositionNormalizer.normalize(new double[]{0.0, 0.0}));
        assertThrows(InvalidCompositionException.class, () -> CompositionNormalizer.normalize(new double[0]));
    }
}
