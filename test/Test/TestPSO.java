package Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import Population.InertiaType;
import Population.PSO;
import Population.PSOConfig;
import Solution.OptResult;

public class TestPSO
{
	private PSOConfig config;

	@BeforeEach
	public void setUp()
	{
		config = new PSOConfig();
	}

	@Test
	public void testSphereConverges()
	{
		OptResult result = new PSO<Double>(config).run(5, SphereFunction.objective(), 0.0);

		assertTrue(result.getBestCost() < 1e-2, "best " + result.getBestCost());
		assertEquals(30L * 501, result.getNumEvaluations());
		double best[] = result.getBest().toDoubleArray();
		for(double v : best)
			assertTrue(v >= config.getLowerBound() && v <= config.getUpperBound());
	}

	@Test
	public void testInertiaSchedules()
	{
		assertEquals(0.729, config.inertiaAt(0), 1e-12);
		assertEquals(0.5645, config.inertiaAt(250), 1e-12);

		config.setInertiaType(InertiaType.Constant);
		assertEquals(0.729, config.inertiaAt(400), 1e-12);

		config.setInertiaType(InertiaType.Constriction);
		assertEquals(1.0, config.constrictionFactor(), 1e-12, "phi <= 4");
		config.setAcceleration(2.05, 2.05);
		assertEquals(0.72984, config.constrictionFactor(), 1e-5);
		assertEquals(config.constrictionFactor(), config.inertiaAt(10), 1e-12);
	}

	@Test
	public void testConstrictionRun()
	{
		config.setInertiaType(InertiaType.Constriction);
		config.setAcceleration(2.05, 2.05);
		config.setMaxIterations(200);
		OptResult result = new PSO<Double>(config).run(3, SphereFunction.objective(), 0.0);

		double conv[] = result.getConvergence();
		for(int i = 1; i < conv.length; i++)
			assertTrue(conv[i] <= conv[i - 1]);
		assertTrue(result.getBestCost() < 1.0);
	}

	@Test
	public void testInvalidConfigAndInput()
	{
		assertThrows(IllegalArgumentException.class, () -> config.setBounds(1.0, 1.0));
		assertThrows(IllegalArgumentException.class, () -> config.setVMaxRatio(0));
		assertTrue(new PSO<Double>(config).run(0, SphereFunction.objective(), 0.0).isEmpty());
	}
}
