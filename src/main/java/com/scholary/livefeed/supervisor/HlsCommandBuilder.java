package com.scholary.livefeed.supervisor;

import com.scholary.livefeed.process.FfmpegProperties;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Builds the ffmpeg command that republishes a source as an HLS playlist.
 *
 * <p>Output is H.264/AAC in short segments. ffmpeg itself keeps the playlist to {@code
 * playlist-size} entries and deletes segments that fall off it.
 */
@Component
public class HlsCommandBuilder {

  public static final String PLAYLIST_NAME = "playlist.m3u8";
  public static final String SEGMENT_PATTERN = "segment_%03d.ts";

  private final FfmpegProperties properties;

  public HlsCommandBuilder(FfmpegProperties properties) {
    this.properties = properties;
  }

  /**
   * Full command line for one stream.
   *
   * @param inputArguments input-side arguments, ending with {@code -i <locator>}
   * @param outputDirectory the stream's private output directory
   * @return the command, binary first
   */
  public List<String> build(List<String> inputArguments, Path outputDirectory) {
    List<String> command = new ArrayList<>();
    command.add(properties.binary());
    command.addAll(inputArguments);

    command.add("-c:v");
    command.add("libx264");
    command.add("-preset");
    command.add(properties.preset());
    command.add("-crf");
    command.add(String.valueOf(properties.crf()));
    command.add("-maxrate");
    command.add(properties.bitrate());
    command.add("-bufsize");
    command.add("2M");
    command.add("-c:a");
    command.add("aac");
    command.add("-b:a");
    command.add(properties.audioBitrate());

    command.add("-f");
    command.add("hls");
    command.add("-hls_time");
    command.add(String.valueOf(properties.segmentDuration()));
    command.add("-hls_list_size");
    command.add(String.valueOf(properties.playlistSize()));
    command.add("-hls_flags");
    command.add("delete_segments");
    command.add("-hls_segment_filename");
    command.add(outputDirectory.resolve(SEGMENT_PATTERN).toString());
    command.add(outputDirectory.resolve(PLAYLIST_NAME).toString());
    return command;
  }
}
