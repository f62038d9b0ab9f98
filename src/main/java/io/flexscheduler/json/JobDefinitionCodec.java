package io.flexscheduler.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.flexscheduler.SchedulerException;
import io.flexscheduler.model.ExitCondition;
import io.flexscheduler.model.FixedWeeklySchedule;
import io.flexscheduler.model.IntervalSchedule;
import io.flexscheduler.model.Job;
import io.flexscheduler.model.JobSchedule;
import io.flexscheduler.model.TimeOfDay;
import io.flexscheduler.model.Weekday;
import io.flexscheduler.model.WeeklySlot;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads and writes job definitions as JSON.
 *
 * <p>A job is written as {@code {"Name": ..., "Schedule": {...}}}. The schedule object starts
 * with a {@code "type"} discriminator holding {@link JobSchedule#typeName()}, followed by the
 * variant fields ({@code IntervalInSeconds} or {@code Slots}) and the common fields ({@code
 * TriggerAtStart}, {@code AfterStartInSeconds}, {@code ExitStrategy}).
 *
 * <p>The older discriminators {@code IntervalJobSchedule} and {@code FixedTimeJobSchedule} are
 * read as aliases of the current ones. A schedule without a discriminator is a format error. A
 * schedule with an unknown discriminator reads as null, and the job is returned without a
 * schedule.
 *
 * <p>Actions are not part of a definition; jobs read back have none. Bind one with {@link
 * Job#withAction}.
 */
public final class JobDefinitionCodec {
  static final String TYPE = "type";
  static final String NAME = "Name";
  static final String SCHEDULE = "Schedule";
  static final String INTERVAL_IN_SECONDS = "IntervalInSeconds";
  static final String SLOTS = "Slots";
  static final String DAY_OF_WEEK = "DayOfWeek";
  static final String TIME_OF_DAY = "TimeOfDay";
  static final String HOUR = "Hour";
  static final String MINUTE = "Minute";
  static final String SECOND = "Second";
  static final String TRIGGER_AT_START = "TriggerAtStart";
  static final String AFTER_START_IN_SECONDS = "AfterStartInSeconds";
  static final String EXIT_STRATEGY = "ExitStrategy";
  static final String MAX_RUN = "MaxRun";
  static final String TILL_TIME = "TillTime";

  // discriminators of older definition files, read but never written
  static final String LEGACY_INTERVAL = "IntervalJobSchedule";
  static final String LEGACY_FIXED_WEEKLY = "FixedTimeJobSchedule";

  private final ObjectMapper mapper;

  public JobDefinitionCodec() {
    this(new ObjectMapper());
  }

  public JobDefinitionCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper);
  }

  // Writing

  /**
   * Writes a job definition.
   *
   * @param job the job
   * @return the JSON text
   */
  public String write(Job job) {
    return stringify(jobToNode(job));
  }

  /**
   * Writes a list of job definitions as a JSON array.
   *
   * @param jobs the jobs
   * @return the JSON text
   */
  public String writeAll(List<Job> jobs) {
    ArrayNode array = mapper.createArrayNode();
    jobs.forEach(job -> array.add(jobToNode(job)));
    return stringify(array);
  }

  /**
   * Converts a job definition to a JSON object.
   *
   * @param job the job
   * @return the JSON object
   */
  public ObjectNode jobToNode(Job job) {
    ObjectNode node = mapper.createObjectNode();
    node.put(NAME, job.name());
    if (job.schedule() == null) {
      node.putNull(SCHEDULE);
    } else {
      node.set(SCHEDULE, scheduleToNode(job.schedule()));
    }
    return node;
  }

  /**
   * Converts a schedule to a JSON object, discriminator first.
   *
   * @param schedule the schedule
   * @return the JSON object
   */
  public ObjectNode scheduleToNode(JobSchedule schedule) {
    ObjectNode node = mapper.createObjectNode();
    node.put(TYPE, schedule.typeName());
    if (schedule instanceof IntervalSchedule is) {
      node.put(INTERVAL_IN_SECONDS, is.intervalSeconds());
    } else if (schedule instanceof FixedWeeklySchedule fw) {
      ArrayNode slots = node.putArray(SLOTS);
      for (WeeklySlot slot : fw.slots()) {
        ObjectNode slotNode = slots.addObject();
        if (slot.dayOfWeek() == null) {
          slotNode.putNull(DAY_OF_WEEK);
        } else {
          slotNode.put(DAY_OF_WEEK, slot.dayOfWeek().displayName());
        }
        ObjectNode time = slotNode.putObject(TIME_OF_DAY);
        time.put(HOUR, slot.timeOfDay().hour());
        time.put(MINUTE, slot.timeOfDay().minute());
        time.put(SECOND, slot.timeOfDay().second());
      }
    }
    node.put(TRIGGER_AT_START, schedule.triggerAtStart());
    node.put(AFTER_START_IN_SECONDS, schedule.afterStartSeconds());
    ExitCondition exit = schedule.exitCondition();
    if (exit.kind() == ExitCondition.Kind.UNBOUNDED) {
      node.putNull(EXIT_STRATEGY);
    } else {
      ObjectNode exitNode = node.putObject(EXIT_STRATEGY);
      if (exit.maxRun() == null) {
        exitNode.putNull(MAX_RUN);
      } else {
        exitNode.put(MAX_RUN, exit.maxRun());
      }
      if (exit.tillTime() == null) {
        exitNode.putNull(TILL_TIME);
      } else {
        exitNode.put(TILL_TIME, exit.tillTime().toString());
      }
    }
    return node;
  }

  private String stringify(JsonNode node) {
    try {
      return mapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  // Reading

  /**
   * Reads a job definition.
   *
   * @param json the JSON text
   * @return the job, without an action
   * @throws SchedulerException if the text is not a valid job definition
   */
  public Job read(String json) throws SchedulerException {
    return readJob(parse(json));
  }

  /**
   * Reads a JSON array of job definitions.
   *
   * @param json the JSON text
   * @return the jobs, in array order
   * @throws SchedulerException if the text is not a valid array of job definitions
   */
  public List<Job> readAll(String json) throws SchedulerException {
    return readJobs(parse(json));
  }

  /**
   * Reads a JSON array of job definitions from a stream, for example a classpath resource.
   *
   * @param in the input stream
   * @return the jobs, in array order
   * @throws SchedulerException if the stream is not a valid array of job definitions
   */
  public List<Job> readAll(InputStream in) throws SchedulerException {
    try {
      return readJobs(mapper.readTree(in));
    } catch (JsonProcessingException e) {
      throw SchedulerException.format("invalid JSON: " + e.getOriginalMessage(), null, e);
    } catch (IOException e) {
      throw SchedulerException.format("cannot read job definitions: " + e.getMessage(), null, e);
    }
  }

  /**
   * Reads a job definition from a JSON object.
   *
   * @param node the JSON object
   * @return the job, without an action
   * @throws SchedulerException if the object is not a valid job definition
   */
  public Job readJob(JsonNode node) throws SchedulerException {
    if (node == null || !node.isObject()) {
      throw SchedulerException.format("job definition must be an object", text(node));
    }
    JsonNode name = node.get(NAME);
    if (name == null || !name.isTextual()) {
      throw SchedulerException.format("job definition has no " + NAME, text(node));
    }
    JsonNode schedule = node.get(SCHEDULE);
    if (schedule == null || schedule.isNull()) {
      return Job.definition(name.asText(), null);
    }
    return Job.definition(name.asText(), readSchedule(schedule));
  }

  /**
   * Reads a schedule from a JSON object.
   *
   * @param node the JSON object
   * @return the schedule, or null if the discriminator names no known schedule type
   * @throws SchedulerException if the discriminator is missing or a field is invalid
   */
  public JobSchedule readSchedule(JsonNode node) throws SchedulerException {
    JsonNode type = node.get(TYPE);
    if (type == null || type.isNull()) {
      throw SchedulerException.format(
          "JSON does not contain schedule type, may be invalid", text(node));
    }
    try {
      boolean triggerAtStart = node.path(TRIGGER_AT_START).asBoolean(false);
      int afterStart = node.path(AFTER_START_IN_SECONDS).asInt(0);
      ExitCondition exit = readExit(node.get(EXIT_STRATEGY));

      switch (type.asText()) {
        case IntervalSchedule.TYPE_NAME:
        case LEGACY_INTERVAL:
          return new IntervalSchedule(
              requireInt(node, INTERVAL_IN_SECONDS), triggerAtStart, afterStart, exit);
        case FixedWeeklySchedule.TYPE_NAME:
        case LEGACY_FIXED_WEEKLY:
          return new FixedWeeklySchedule(readSlots(node), triggerAtStart, afterStart, exit);
        default:
          return null;
      }
    } catch (IllegalArgumentException e) {
      throw SchedulerException.format(e.getMessage(), text(node), e);
    }
  }

  private List<Job> readJobs(JsonNode root) throws SchedulerException {
    if (root == null || !root.isArray()) {
      throw SchedulerException.format("job definitions must be an array", text(root));
    }
    List<Job> jobs = new ArrayList<>(root.size());
    for (JsonNode node : root) {
      jobs.add(readJob(node));
    }
    return jobs;
  }

  private List<WeeklySlot> readSlots(JsonNode node) throws SchedulerException {
    JsonNode slots = node.get(SLOTS);
    if (slots == null || !slots.isArray()) {
      throw SchedulerException.format(SLOTS + " must be an array", text(node));
    }
    List<WeeklySlot> result = new ArrayList<>(slots.size());
    for (JsonNode slot : slots) {
      JsonNode time = slot.get(TIME_OF_DAY);
      if (time == null || !time.isObject()) {
        throw SchedulerException.format("slot has no " + TIME_OF_DAY, text(slot));
      }
      TimeOfDay timeOfDay =
          new TimeOfDay(
              requireInt(time, HOUR), requireInt(time, MINUTE), time.path(SECOND).asInt(0));
      result.add(new WeeklySlot(readWeekday(slot.get(DAY_OF_WEEK)), timeOfDay));
    }
    return result;
  }

  private static Weekday readWeekday(JsonNode node) throws SchedulerException {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isInt()) {
      return Weekday.fromWeekOrdinal(node.asInt())
          .orElseThrow(() -> SchedulerException.format("invalid day of week", node.toString()));
    }
    return Weekday.parse(node.asText())
        .orElseThrow(() -> SchedulerException.format("invalid day of week", node.toString()));
  }

  private static ExitCondition readExit(JsonNode node) throws SchedulerException {
    if (node == null || node.isNull()) {
      return ExitCondition.unbounded();
    }
    JsonNode maxRun = node.get(MAX_RUN);
    JsonNode tillTime = node.get(TILL_TIME);
    Integer max = maxRun == null || maxRun.isNull() ? null : maxRun.asInt();
    Instant till = null;
    if (tillTime != null && !tillTime.isNull()) {
      try {
        till = OffsetDateTime.parse(tillTime.asText()).toInstant();
      } catch (DateTimeParseException e) {
        throw SchedulerException.format("invalid " + TILL_TIME, tillTime.asText(), e);
      }
    }
    return new ExitCondition(max, till);
  }

  private static int requireInt(JsonNode node, String field) throws SchedulerException {
    JsonNode value = node.get(field);
    if (value == null || !value.canConvertToInt()) {
      throw SchedulerException.format("missing or invalid " + field, text(node));
    }
    return value.asInt();
  }

  private JsonNode parse(String json) throws SchedulerException {
    try {
      return mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw SchedulerException.format("invalid JSON: " + e.getOriginalMessage(), json, e);
    }
  }

  private static String text(JsonNode node) {
    return node == null ? null : node.toString();
  }
}
