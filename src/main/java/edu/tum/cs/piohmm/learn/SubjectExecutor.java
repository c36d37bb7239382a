package edu.tum.cs.piohmm.learn;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import edu.tum.cs.piohmm.PiohmmException;
import edu.tum.cs.piohmm.model.Subject;

/**
 * Runs one task per subject on a fixed thread pool and waits for all of them. A {@link PiohmmException} thrown by a
 * task is recorded as that subject's outcome and does not affect the other subjects; any other exception is
 * rethrown.
 */
public class SubjectExecutor {

	public interface SubjectTask<T> {
		T call(int index, Subject subject);
	}

	public static class Outcome<T> {
		private final String subjectId;
		private final T value;
		private final PiohmmException error;

		private Outcome(String subjectId, T value, PiohmmException error) {
			this.subjectId = subjectId;
			this.value = value;
			this.error = error;
		}

		public String getSubjectId() {
			return subjectId;
		}

		public boolean isFailure() {
			return error != null;
		}

		public PiohmmException getError() {
			return error;
		}

		/** @throws PiohmmException the recorded error, if the task failed */
		public T get() {
			if (error != null)
				throw error;
			return value;
		}
	}

	private final int numThreads;

	public SubjectExecutor(int numThreads) {
		this.numThreads = numThreads;
	}

	public int getNumThreads() {
		return numThreads;
	}

	/** @return outcomes in the order of the given subjects */
	public <T> List<Outcome<T>> map(List<Subject> subjects, final SubjectTask<T> task) {
		List<Outcome<T>> outcomes = new ArrayList<Outcome<T>>(subjects.size());
		if (numThreads == 1) {
			for (int i = 0; i < subjects.size(); i++)
				outcomes.add(runTask(task, i, subjects.get(i)));
			return outcomes;
		}

		List<Future<Outcome<T>>> futures = new ArrayList<Future<Outcome<T>>>(subjects.size());
		ExecutorService pool = Executors.newFixedThreadPool(Math.min(numThreads, Math.max(1, subjects.size())));
		try {
			for (int i = 0; i < subjects.size(); i++) {
				final int idx = i;
				final Subject subject = subjects.get(i);
				futures.add(pool.submit(new Callable<Outcome<T>>() {
					@Override
					public Outcome<T> call() throws Exception {
						return runTask(task, idx, subject);
					}
				}));
			}
			for (Future<Outcome<T>> f : futures) {
				try {
					outcomes.add(f.get());
				} catch (InterruptedException ex) {
					Thread.currentThread().interrupt();
					throw new PiohmmException("interrupted while waiting for subject tasks");
				} catch (ExecutionException ex) {
					Throwable cause = ex.getCause();
					if (cause instanceof RuntimeException)
						throw (RuntimeException) cause;
					if (cause instanceof Error)
						throw (Error) cause;
					throw new RuntimeException(cause);
				}
			}
		} finally {
			pool.shutdownNow();
		}
		return outcomes;
	}

	private static <T> Outcome<T> runTask(SubjectTask<T> task, int index, Subject subject) {
		try {
			return new Outcome<T>(subject.getId(), task.call(index, subject), null);
		} catch (PiohmmException ex) {
			PiohmmException error = (ex.getSubjectId() != null) ? ex : ex.forSubject(subject.getId());
			return new Outcome<T>(subject.getId(), null, error);
		}
	}

}
