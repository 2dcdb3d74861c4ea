package io.cryojob4j.internal.relion;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Flags each RELION program accepts, used to warn about mistyped pass-through arguments.
 *
 * <p>Not exhaustive: unknown flags are still passed to the program.
 */
public final class RelionFlags {

    private static final Map<String, Set<String>> FLAGS = Map.of(
            "relion_run_motioncorr", Set.of(
                    "--i", "--o", "--pipeline_control",
                    "--first_frame_sum", "--last_frame_sum",
                    "--bin_factor", "--bfactor", "--dose_per_frame", "--preexposure",
                    "--patch_x", "--patch_y", "--eer_grouping",
                    "--gainref", "--gain_rot", "--gain_flip", "--defect_file",
                    "--float16", "--dose_weighting", "--save_noDW", "--grouping_for_ps",
                    "--j", "--gpu",
                    "--use_own", "--use_motioncor2", "--motioncor2_exe",
                    "--do_thumbnails", "--thumbnail_size", "--thumbnail_count",
                    "--angpix", "--voltage", "--Cs",
                    "--only_do_unfinished", "--version"),
            "relion_run_ctffind", Set.of(
                    "--i", "--o", "--pipeline_control",
                    "--ctffind_exe", "--is_ctffind4", "--use_gctf", "--gctf_exe",
                    "--ctfWin", "--Box", "--ResMin", "--ResMax",
                    "--dFMin", "--dFMax", "--FStep", "--dAst",
                    "--use_given_ps", "--use_noDW",
                    "--fast_search", "--do_phaseshift", "--phase_min", "--phase_max", "--phase_step",
                    "--do_thumbnails", "--thumbnail_size", "--thumbnail_count",
                    "--gpu", "--j",
                    "--only_do_unfinished", "--version"),
            "relion_refine", Set.of(
                    "--o", "--i", "--continue", "--pipeline_control",
                    "--dont_combine_weights_via_disc", "--pool", "--j",
                    "--ctf", "--ctf_intact_first_peak",
                    "--iter", "--tau2_fudge", "--particle_diameter",
                    "--K", "--flatten_solvent", "--zero_mask", "--center_classes",
                    "--oversampling", "--psi_step", "--offset_range", "--offset_step",
                    "--norm", "--scale",
                    "--grad", "--class_inactivity_threshold", "--grad_write_iter", "--grad_ini_subset",
                    "--strict_highres_exp",
                    "--ref", "--trust_ref_size", "--ini_high", "--sym",
                    "--solvent_mask", "--solvent_mask2", "--firstiter_cc", "--fast_subsets",
                    "--gpu", "--blush", "--preread_images", "--scratch_dir",
                    "--skip_align", "--no_parallel_disc_io",
                    "--auto_refine", "--split_random_halves", "--auto_local_healpix_order",
                    "--low_resol_join_halves", "--auto_ignore_angles", "--auto_resol_angles",
                    "--relax_sym", "--solvent_correct_fsc",
                    "--sigma_tilt", "--sigma_psi", "--sigma_rot", "--sigma_ang",
                    "--healpix_order", "--allow_coarser_sampling", "--pad",
                    "--helix", "--helical_inner_diameter", "--helical_outer_diameter",
                    "--helical_nr_asu", "--helical_twist_initial", "--helical_rise_initial",
                    "--helical_z_percentage", "--helical_keep_tilt_prior_fixed",
                    "--helical_symmetry_search", "--helical_twist_min", "--helical_twist_max",
                    "--helical_twist_inistep", "--helical_rise_min", "--helical_rise_max",
                    "--helical_rise_inistep", "--helical_sigma_distance",
                    "--helical_offset_step", "--bimodal_psi", "--helical_rise",
                    "--multibody_masks", "--reconstruct_subtracted_bodies", "--perturb",
                    "--free_gpu_memory", "--skip_gridding", "--onthefly_lowpass",
                    "--do_em", "--write_iter", "--auto_iter_max",
                    "--only_do_unfinished", "--version"),
            "relion_ctf_refine", Set.of(
                    "--i", "--o", "--f", "--j", "--pipeline_control",
                    "--fit_aniso", "--kmin_mag",
                    "--fit_defocus", "--kmin_defocus",
                    "--fit_mode",
                    "--fit_beamtilt", "--kmin_tilt",
                    "--odd_aberr_max_n", "--fit_aberr",
                    "--angpix", "--mask",
                    "--only_do_unfinished", "--version"),
            "relion_flex_analyse", Set.of(
                    "--PCA_orient", "--model", "--data", "--bodies", "--o",
                    "--do_maps", "--k", "--write_pca_projections",
                    "--select_eigenvalue", "--select_eigenvalue_min", "--select_eigenvalue_max",
                    "--pipeline_control", "--version")
    );

    private RelionFlags() {
    }

    /**
     * Known flags for {@code program}; the {@code _mpi} suffix is ignored.
     */
    public static Optional<Set<String>> knownFlags(String program) {
        if (program == null) {
            return Optional.empty();
        }
        String base = program.endsWith("_mpi") ? program.substring(0, program.length() - 4) : program;
        return Optional.ofNullable(FLAGS.get(base));
    }
}
