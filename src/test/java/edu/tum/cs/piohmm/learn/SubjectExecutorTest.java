package edu.tum.cs.piohmm.learn;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import edu.tum.cs.piohmm.NumericalInstabilityException;
import edu.tum.cs.piohmm.PiohmmException;
import edu.tum.cs.piohmm.model.Subject;

public class SubjectExecutorTest {

	private static List<Subject> createSubjects(int n) {
		List<Subject> subjects = new ArrayList<Subject>();
		for (int i = 0; i < n; i++)
			subjects.add(Subject.univariate("s" + i, new double[i + 1][0], new double[i + 1]));
		return subjects;
	}

	private static final SubjectExecutor.SubjectTask<Integer> lengthTask = new SubjectExecutor.SubjectTask<Integer>() {
		@Override
		public Integer call(int index, Subject subject) {
			if (subject.getId().equals("s3"))
				throw new NumericalInstabilityException("overflow");
			return subject.length();
		}
	};

	private static void checkOutcomes(List<SubjectExecutor.Outcome<Integer>> outcomes) {
		assertEquals(10, outcomes.size());
		for (int i = 0; i < outcomes.size(); i++) {
			SubjectExecutor.Outcome<Integer> o = outcomes.get(i);
			assertEquals("s" + i, o.getSubjectId());
			if (i == 3) {
				assertTrue(o.isFailure());
				assertTrue(o.getError() instanceof NumericalInstabilityException);
				assertEquals("s3", o.getError().getSubjectId());
				try {
					o.get();
					fail("expected NumericalInstabilityException");
				} catch (NumericalInstabilityException ex) {
					// expected
				}
			} else {
				assertFalse(o.isFailure());
				assertEquals(i + 1, o.get().intValue());
			}
		}
	}

	@Test
	public void testSerial() {
		checkOutcomes(new SubjectExecutor(1).map(createSubjects(10), lengthTask));
	}

	@Test
	public void testParallel() {
		checkOutcomes(new SubjectExecutor(4).map(createSubjects(10), lengthTask));
	}

	@Test
	public void testKeepsSubjectId() {
		List<SubjectExecutor.Outcome<Integer>> outcomes = new SubjectExecutor(2).map(createSubjects(2),
				new SubjectExecutor.SubjectTask<Integer>() {
					@Override
					public Integer call(int index, Subject subject) {
						throw new PiohmmException("failed", "other");
					}
				});
		assertEquals("other", outcomes.get(0).getError().getSubjectId());
		assertEquals("s0", outcomes.get(0).getSubjectId());
	}

	@Test(expected = IllegalStateException.class)
	public void testProgrammingError() {
		new SubjectExecutor(3).map(createSubjects(5), new SubjectExecutor.SubjectTask<Integer>() {
			@Override
			public Integer call(int index, Subject subject) {
				throw new IllegalStateException("bug");
			}
		});
	}

}
